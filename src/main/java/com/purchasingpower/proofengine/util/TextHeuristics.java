package com.purchasingpower.proofengine.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Word-overlap and normalization helpers shared by the analysis passes.
 *
 * <p>These are surface heuristics, not semantic comparison.
 */
public final class TextHeuristics {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[.,;:!?]");

    private TextHeuristics() {
    }

    /**
     * Lower-cased whitespace-separated words strictly longer than {@code minExclusiveLength}.
     */
    public static Set<String> significantWords(String text, int minExclusiveLength) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(WHITESPACE.split(text.toLowerCase(Locale.ROOT).trim()))
                .filter(w -> w.length() > minExclusiveLength)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Shared words divided by the size of the smaller word set.
     */
    public static double overlapOfSmaller(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        return (double) countShared(a, b) / Math.min(a.size(), b.size());
    }

    /**
     * Shared words divided by the size of the larger word set.
     */
    public static double overlapOfLarger(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        return (double) countShared(a, b) / Math.max(a.size(), b.size());
    }

    public static int countShared(Set<String> a, Set<String> b) {
        int shared = 0;
        for (String word : a) {
            if (b.contains(word)) {
                shared++;
            }
        }
        return shared;
    }

    /**
     * Lower-cases, collapses whitespace and strips sentence punctuation.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return PUNCTUATION.matcher(collapsed).replaceAll("").trim();
    }

    public static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
