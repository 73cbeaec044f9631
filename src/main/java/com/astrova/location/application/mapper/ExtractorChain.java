package com.astrova.location.application.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered list of field extractors; the first one yielding a non-blank value wins.
 *
 * @param <T> Record type the extractors read from
 */
public final class ExtractorChain<T> {

    private final List<Function<T, String>> extractors;

    private ExtractorChain(List<Function<T, String>> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    @SafeVarargs
    public static <T> ExtractorChain<T> of(Function<T, String>... extractors) {
        return new ExtractorChain<>(List.of(extractors));
    }

    /**
     * Returns a chain that tries this chain's extractors first, then the given one.
     */
    public ExtractorChain<T> orElse(Function<T, String> fallback) {
        List<Function<T, String>> extended = new ArrayList<>(extractors);
        extended.add(fallback);
        return new ExtractorChain<>(extended);
    }

    public Optional<String> extract(T source) {
        if (source == null) {
            return Optional.empty();
        }
        for (Function<T, String> extractor : extractors) {
            String value = extractor.apply(source);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    public String extractOrEmpty(T source) {
        return extract(source).orElse("");
    }
}
