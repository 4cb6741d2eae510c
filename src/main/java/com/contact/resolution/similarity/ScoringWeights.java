package com.contact.resolution.similarity;

/**
 * Signal weights and thresholds for duplicate scoring.
 *
 * @param emailWeight             added when emails match exactly (case-insensitive)
 * @param phoneWeight             added when phones match after E.164 normalization
 * @param fuzzyNameWeight         added when the full-name ratio exceeds {@code nameSimilarityThreshold}
 * @param companyWeight           added when companies match exactly (case-insensitive)
 * @param nameSimilarityThreshold strict lower bound on the name ratio
 * @param duplicateThreshold      minimum score for a pair without an exact match to qualify
 */
public record ScoringWeights(
        double emailWeight,
        double phoneWeight,
        double fuzzyNameWeight,
        double companyWeight,
        double nameSimilarityThreshold,
        double duplicateThreshold
) {
    public static final double DEFAULT_EMAIL_WEIGHT = 0.9;
    public static final double DEFAULT_PHONE_WEIGHT = 0.8;
    public static final double DEFAULT_FUZZY_NAME_WEIGHT = 0.3;
    public static final double DEFAULT_COMPANY_WEIGHT = 0.1;
    public static final double DEFAULT_NAME_SIMILARITY_THRESHOLD = 0.85;
    public static final double DEFAULT_DUPLICATE_THRESHOLD = 0.5;

    public ScoringWeights {
        requireUnit("emailWeight", emailWeight);
        requireUnit("phoneWeight", phoneWeight);
        requireUnit("fuzzyNameWeight", fuzzyNameWeight);
        requireUnit("companyWeight", companyWeight);
        requireUnit("nameSimilarityThreshold", nameSimilarityThreshold);
        requireUnit("duplicateThreshold", duplicateThreshold);
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(
                DEFAULT_EMAIL_WEIGHT,
                DEFAULT_PHONE_WEIGHT,
                DEFAULT_FUZZY_NAME_WEIGHT,
                DEFAULT_COMPANY_WEIGHT,
                DEFAULT_NAME_SIMILARITY_THRESHOLD,
                DEFAULT_DUPLICATE_THRESHOLD);
    }

    public ScoringWeights withDuplicateThreshold(double threshold) {
        return new ScoringWeights(emailWeight, phoneWeight, fuzzyNameWeight, companyWeight,
                nameSimilarityThreshold, threshold);
    }

    public ScoringWeights withNameSimilarityThreshold(double threshold) {
        return new ScoringWeights(emailWeight, phoneWeight, fuzzyNameWeight, companyWeight,
                threshold, duplicateThreshold);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }
}
