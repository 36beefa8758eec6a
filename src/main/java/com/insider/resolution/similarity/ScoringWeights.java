package com.insider.resolution.similarity;

/**
 * Tuning for {@link MatchScorer}.
 *
 * @param tokenOverlapCeiling highest score a non-exact match can reach
 * @param editDistanceWeight  share of the Levenshtein fuzzy credit blended into partial matches
 * @param fuzzyTokenFloor     minimum per-word similarity for a misspelled word to earn credit
 * @param matchThreshold      score at or above which a candidate counts as a match
 */
public record ScoringWeights(
        double tokenOverlapCeiling,
        double editDistanceWeight,
        double fuzzyTokenFloor,
        double matchThreshold
) {
    public ScoringWeights {
        if (tokenOverlapCeiling <= 0.0 || tokenOverlapCeiling >= 1.0) {
            throw new IllegalArgumentException("tokenOverlapCeiling must be in (0, 1), got " + tokenOverlapCeiling);
        }
        if (editDistanceWeight < 0.0 || editDistanceWeight > 1.0) {
            throw new IllegalArgumentException("editDistanceWeight must be in [0, 1], got " + editDistanceWeight);
        }
        if (fuzzyTokenFloor <= 0.0 || fuzzyTokenFloor > 1.0) {
            throw new IllegalArgumentException("fuzzyTokenFloor must be in (0, 1], got " + fuzzyTokenFloor);
        }
        if (matchThreshold <= 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("matchThreshold must be in (0, 1], got " + matchThreshold);
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.9, 0.9, 0.8, MatchScorer.MATCH_THRESHOLD);
    }

    /**
     * Fewer false positives: misspellings earn less and the bar is higher.
     */
    public static ScoringWeights strict() {
        return new ScoringWeights(0.9, 0.5, 0.9, 0.85);
    }

    /**
     * Tolerates heavier misspelling, at the cost of more false positives.
     */
    public static ScoringWeights lenient() {
        return new ScoringWeights(0.9, 1.0, 0.7, 0.65);
    }
}
