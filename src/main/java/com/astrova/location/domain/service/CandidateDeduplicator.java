package com.astrova.location.domain.service;

import com.astrova.location.domain.model.CoordinateKey;
import com.astrova.location.domain.model.Coordinates;
import com.astrova.location.domain.model.LocationCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merges candidates coming from several sources into one display-ready list.
 *
 * Candidates are bucketed by semantic signature ({@code name|state|country}) and then by
 * coordinates rounded to 3 decimals. Each bucket keeps a single candidate, the one from the
 * highest-ranked source (first seen on ties). Survivors get a synthesized display name and
 * a deterministic order: source rank descending, then name.
 */
@Service
public class CandidateDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(CandidateDeduplicator.class);

    private static final Comparator<LocationCandidate> DISPLAY_ORDER =
        Comparator.comparingInt((LocationCandidate c) -> c.getSource().getRank()).reversed()
            .thenComparing(CandidateDeduplicator::sortLabel)
            .thenComparing(LocationCandidate::getDisplayName);

    private final SignatureNormalizer signatureNormalizer;
    private final CoordinateTransformer coordinateTransformer;
    private final DisplayNameFormatter displayNameFormatter;

    public CandidateDeduplicator(
        SignatureNormalizer signatureNormalizer,
        CoordinateTransformer coordinateTransformer,
        DisplayNameFormatter displayNameFormatter
    ) {
        this.signatureNormalizer = signatureNormalizer;
        this.coordinateTransformer = coordinateTransformer;
        this.displayNameFormatter = displayNameFormatter;
    }

    /**
     * Deduplicates, relabels, orders and truncates candidates. Never throws.
     *
     * @param candidates Candidates in priority-neutral arrival order; null entries are skipped
     * @param limit Maximum number of results
     * @return At most {@code limit} distinct candidates
     */
    public List<LocationCandidate> deduplicate(List<LocationCandidate> candidates, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, Map<CoordinateKey, LocationCandidate>> bySignature = new LinkedHashMap<>();
        int skipped = 0;
        for (LocationCandidate candidate : candidates) {
            if (candidate == null
                || !Coordinates.isValid(candidate.getLatitude(), candidate.getLongitude())) {
                skipped++;
                continue;
            }
            String signature = signatureNormalizer.signatureOf(candidate);
            CoordinateKey coordinateKey = coordinateTransformer.transform(candidate);
            bySignature
                .computeIfAbsent(signature, key -> new LinkedHashMap<>())
                .merge(coordinateKey, candidate, CandidateDeduplicator::preferred);
        }

        List<LocationCandidate> survivors = new ArrayList<>();
        for (Map<CoordinateKey, LocationCandidate> bucket : bySignature.values()) {
            for (LocationCandidate survivor : bucket.values()) {
                survivors.add(survivor.withDisplayName(displayNameFormatter.synthesize(survivor)));
            }
        }
        survivors.sort(DISPLAY_ORDER);

        logger.debug("Deduplicated {} candidates into {} ({} skipped)",
            candidates.size(), survivors.size(), skipped);

        return survivors.size() > limit ? List.copyOf(survivors.subList(0, limit)) : List.copyOf(survivors);
    }

    public String signatureOf(LocationCandidate candidate) {
        return signatureNormalizer.signatureOf(candidate);
    }

    public CoordinateKey coordinateKeyOf(LocationCandidate candidate) {
        return coordinateTransformer.transform(candidate);
    }

    private static LocationCandidate preferred(LocationCandidate existing, LocationCandidate incoming) {
        return incoming.getSource().outranks(existing.getSource()) ? incoming : existing;
    }

    private static String sortLabel(LocationCandidate candidate) {
        String label = candidate.getName().isBlank() ? candidate.getCity() : candidate.getName();
        return label.toLowerCase(Locale.ROOT);
    }
}
