package com.csd.codeagent.service.aggregator;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Jaccard similarity over lowercase word tokens.
 */
public final class TitleSimilarity {

    private TitleSimilarity() {}

    public static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return normalize(a).equals(normalize(b)) ? 1.0 : 0.0;
        }
        Set<String> union = new LinkedHashSet<>(left);
        union.addAll(right);
        int shared = 0;
        for (String token : left) {
            if (right.contains(token)) shared++;
        }
        return (double) shared / union.size();
    }

    public static String normalize(String text) {
        if (text == null) return "";
        return text.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static Set<String> tokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : normalize(text).split("\\W+")) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }
}
