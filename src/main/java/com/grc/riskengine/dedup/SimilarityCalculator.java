package com.grc.riskengine.dedup;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Jaccard similarity helpers. An empty union scores 0.
 */
public final class SimilarityCalculator {

    private SimilarityCalculator() {
    }

    public static double jaccard(Collection<String> a, Collection<String> b) {
        Set<String> left = normalize(a);
        Set<String> right = normalize(b);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size();
    }

    /** Jaccard over whitespace-separated, lower-cased words. */
    public static double titleSimilarity(String a, String b) {
        return jaccard(tokens(a), tokens(b));
    }

    static Set<String> tokens(String text) {
        if (text == null) return Set.of();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    private static Set<String> normalize(Collection<String> values) {
        if (values == null) return Set.of();
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
