package com.contact.resolution.similarity;

/**
 * String similarity measure used for fuzzy name comparison.
 * Implementations return a ratio between 0.0 (nothing in common) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
