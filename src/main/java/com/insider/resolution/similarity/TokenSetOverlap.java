package com.insider.resolution.similarity;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Order-free word overlap between two names.
 *
 * <p>Names of two or more words on both sides are compared by overlap coefficient
 * ({@code |A ∩ B| / min(|A|, |B|)}), so a spelled-out middle name on one side does not
 * penalize an otherwise exact match. When either side is a single word, plain Jaccard is
 * used so a lone surname cannot match a full name outright.</p>
 */
public class TokenSetOverlap implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> a = words(s1);
        Set<String> b = words(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty() ? 1.0 : 0.0;
        }
        int matched = (int) a.stream().filter(b::contains).count();
        return ratio(matched, a.size(), b.size());
    }

    @Override
    public String getName() {
        return "TokenSetOverlap";
    }

    /**
     * Overlap ratio for {@code matched} shared tokens between sets of the given sizes.
     * {@code matched} may be fractional when fuzzy credit is included.
     */
    public static double ratio(double matched, int sizeA, int sizeB) {
        if (sizeA == 0 || sizeB == 0) {
            return 0.0;
        }
        int smaller = Math.min(sizeA, sizeB);
        double value = smaller >= 2
                ? matched / smaller
                : matched / (sizeA + sizeB - matched);
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Set<String> words(String s) {
        return Arrays.stream(s.toLowerCase(Locale.ROOT).split("[\\s,]+"))
                .filter(t -> !t.isBlank())
                .collect(Collectors.toSet());
    }
}
