package com.insider.resolution.similarity;

/**
 * Interface for pairwise string similarity algorithms.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes similarity between two strings.
     *
     * @return similarity score between 0.0 (no similarity) and 1.0 (identical)
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
