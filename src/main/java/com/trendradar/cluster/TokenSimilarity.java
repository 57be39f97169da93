package com.trendradar.cluster;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Token overlap between normalization keys (intersection over union of space-delimited tokens).
 */
public final class TokenSimilarity {

    private TokenSimilarity() {
    }

    public static Set<String> tokens(String normalizationKey) {
        if (normalizationKey == null || normalizationKey.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String token : normalizationKey.split(" ")) {
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int shared = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                shared++;
            }
        }
        int union = a.size() + b.size() - shared;
        return (double) shared / union;
    }

    public static double jaccard(String keyA, String keyB) {
        return jaccard(tokens(keyA), tokens(keyB));
    }
}
