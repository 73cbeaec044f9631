package com.astrova.location.domain.service;

import com.astrova.location.domain.model.LocationCandidate;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the semantic signature used to group candidates that likely name the same place.
 */
@Service
public class SignatureNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String SEPARATOR = "|";

    /**
     * Signature of the form {@code name|state|country}. Falls back to the city when the
     * candidate has no name.
     */
    public String signatureOf(LocationCandidate candidate) {
        String label = candidate.getName().isBlank() ? candidate.getCity() : candidate.getName();
        return normalize(label) + SEPARATOR
            + normalize(candidate.getState()) + SEPARATOR
            + normalize(candidate.getCountry());
    }

    /**
     * Decomposes, strips diacritics, lower-cases and collapses whitespace.
     */
    public String normalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFKD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}
