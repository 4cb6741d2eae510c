package com.contact.resolution.api;

import com.contact.resolution.merge.MergeStrategy;
import com.contact.resolution.similarity.ScoringWeights;

/**
 * Options for duplicate discovery and merging.
 */
public class DeduplicationOptions {

    private static final int DEFAULT_MAX_FUZZY_CANDIDATES = 500;
    private static final int DEFAULT_MAX_CONFLICT_RETRIES = 3;

    private final double duplicateThreshold;
    private final double nameSimilarityThreshold;
    private final double emailWeight;
    private final double phoneWeight;
    private final double fuzzyNameWeight;
    private final double companyWeight;
    private final int maxFuzzyCandidates;
    private final int maxConflictRetries;
    private final MergeStrategy defaultMergeStrategy;
    private final String sourceSystem;

    private DeduplicationOptions(Builder builder) {
        this.duplicateThreshold = builder.duplicateThreshold;
        this.nameSimilarityThreshold = builder.nameSimilarityThreshold;
        this.emailWeight = builder.emailWeight;
        this.phoneWeight = builder.phoneWeight;
        this.fuzzyNameWeight = builder.fuzzyNameWeight;
        this.companyWeight = builder.companyWeight;
        this.maxFuzzyCandidates = builder.maxFuzzyCandidates;
        this.maxConflictRetries = builder.maxConflictRetries;
        this.defaultMergeStrategy = builder.defaultMergeStrategy;
        this.sourceSystem = builder.sourceSystem;
    }

    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public double getNameSimilarityThreshold() {
        return nameSimilarityThreshold;
    }

    public double getEmailWeight() {
        return emailWeight;
    }

    public double getPhoneWeight() {
        return phoneWeight;
    }

    public double getFuzzyNameWeight() {
        return fuzzyNameWeight;
    }

    public double getCompanyWeight() {
        return companyWeight;
    }

    public int getMaxFuzzyCandidates() {
        return maxFuzzyCandidates;
    }

    public int getMaxConflictRetries() {
        return maxConflictRetries;
    }

    public MergeStrategy getDefaultMergeStrategy() {
        return defaultMergeStrategy;
    }

    /**
     * Recorded as the actor of merges that do not name one.
     */
    public String getSourceSystem() {
        return sourceSystem;
    }

    public ScoringWeights toScoringWeights() {
        return new ScoringWeights(emailWeight, phoneWeight, fuzzyNameWeight, companyWeight,
                nameSimilarityThreshold, duplicateThreshold);
    }

    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    /**
     * Fewer false positives: names must be closer and weak signals must add up to more.
     */
    public static DeduplicationOptions strict() {
        return builder()
                .duplicateThreshold(0.8)
                .nameSimilarityThreshold(0.92)
                .maxFuzzyCandidates(200)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double duplicateThreshold = ScoringWeights.DEFAULT_DUPLICATE_THRESHOLD;
        private double nameSimilarityThreshold = ScoringWeights.DEFAULT_NAME_SIMILARITY_THRESHOLD;
        private double emailWeight = ScoringWeights.DEFAULT_EMAIL_WEIGHT;
        private double phoneWeight = ScoringWeights.DEFAULT_PHONE_WEIGHT;
        private double fuzzyNameWeight = ScoringWeights.DEFAULT_FUZZY_NAME_WEIGHT;
        private double companyWeight = ScoringWeights.DEFAULT_COMPANY_WEIGHT;
        private int maxFuzzyCandidates = DEFAULT_MAX_FUZZY_CANDIDATES;
        private int maxConflictRetries = DEFAULT_MAX_CONFLICT_RETRIES;
        private MergeStrategy defaultMergeStrategy = MergeStrategy.defaults();
        private String sourceSystem = "system";

        public Builder duplicateThreshold(double duplicateThreshold) {
            validateUnit(duplicateThreshold, "duplicateThreshold");
            this.duplicateThreshold = duplicateThreshold;
            return this;
        }

        public Builder nameSimilarityThreshold(double nameSimilarityThreshold) {
            validateUnit(nameSimilarityThreshold, "nameSimilarityThreshold");
            this.nameSimilarityThreshold = nameSimilarityThreshold;
            return this;
        }

        public Builder emailWeight(double emailWeight) {
            validateUnit(emailWeight, "emailWeight");
            this.emailWeight = emailWeight;
            return this;
        }

        public Builder phoneWeight(double phoneWeight) {
            validateUnit(phoneWeight, "phoneWeight");
            this.phoneWeight = phoneWeight;
            return this;
        }

        public Builder fuzzyNameWeight(double fuzzyNameWeight) {
            validateUnit(fuzzyNameWeight, "fuzzyNameWeight");
            this.fuzzyNameWeight = fuzzyNameWeight;
            return this;
        }

        public Builder companyWeight(double companyWeight) {
            validateUnit(companyWeight, "companyWeight");
            this.companyWeight = companyWeight;
            return this;
        }

        public Builder maxFuzzyCandidates(int maxFuzzyCandidates) {
            if (maxFuzzyCandidates <= 0) {
                throw new IllegalArgumentException("maxFuzzyCandidates must be positive");
            }
            this.maxFuzzyCandidates = maxFuzzyCandidates;
            return this;
        }

        public Builder maxConflictRetries(int maxConflictRetries) {
            if (maxConflictRetries < 0) {
                throw new IllegalArgumentException("maxConflictRetries must not be negative");
            }
            this.maxConflictRetries = maxConflictRetries;
            return this;
        }

        public Builder defaultMergeStrategy(MergeStrategy defaultMergeStrategy) {
            this.defaultMergeStrategy = defaultMergeStrategy != null ? defaultMergeStrategy : MergeStrategy.defaults();
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public DeduplicationOptions build() {
            return new DeduplicationOptions(this);
        }

        private void validateUnit(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
