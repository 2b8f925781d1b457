package org.modulematch.service;

import java.util.Properties;

/**
 * Thresholds and list sizes for phenotype prediction and question selection.
 */
public final class PredictionConfig {
    public static final double DEFAULT_MIN_PREVALENCE = 20.0;
    public static final int DEFAULT_MAX_PREDICTIONS = 10;
    public static final int DEFAULT_EXPECTED_PHENOTYPES = 20;
    public static final int DEFAULT_DISCRIMINATIVE_QUESTIONS = 20;
    public static final double DEFAULT_DISCRIMINATIVE_MIN_AVERAGE_PREVALENCE = 10.0;

    private final double minPrevalence;
    private final int maxPredictions;
    private final int expectedPhenotypes;
    private final int discriminativeQuestions;
    private final double discriminativeMinAveragePrevalence;

    private PredictionConfig(Builder builder) {
        this.minPrevalence = builder.minPrevalence;
        this.maxPredictions = builder.maxPredictions;
        this.expectedPhenotypes = builder.expectedPhenotypes;
        this.discriminativeQuestions = builder.discriminativeQuestions;
        this.discriminativeMinAveragePrevalence = builder.discriminativeMinAveragePrevalence;
    }

    public static PredictionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PredictionConfig fromProperties(Properties properties) {
        return builder()
                .minPrevalence(ConfigProperties.getDouble(properties, "prediction.minPrevalence", DEFAULT_MIN_PREVALENCE))
                .maxPredictions(ConfigProperties.getInt(properties, "prediction.maxPredictions", DEFAULT_MAX_PREDICTIONS))
                .expectedPhenotypes(ConfigProperties.getInt(properties, "prediction.expectedPhenotypes", DEFAULT_EXPECTED_PHENOTYPES))
                .discriminativeQuestions(ConfigProperties.getInt(properties, "prediction.discriminativeQuestions", DEFAULT_DISCRIMINATIVE_QUESTIONS))
                .discriminativeMinAveragePrevalence(ConfigProperties.getDouble(properties,
                        "prediction.discriminativeMinAveragePrevalence", DEFAULT_DISCRIMINATIVE_MIN_AVERAGE_PREVALENCE))
                .build();
    }

    /** Phenotypes below this prevalence are never predicted as missing. */
    public double getMinPrevalence() {
        return minPrevalence;
    }

    public int getMaxPredictions() {
        return maxPredictions;
    }

    public int getExpectedPhenotypes() {
        return expectedPhenotypes;
    }

    public int getDiscriminativeQuestions() {
        return discriminativeQuestions;
    }

    public double getDiscriminativeMinAveragePrevalence() {
        return discriminativeMinAveragePrevalence;
    }

    @Override
    public String toString() {
        return "PredictionConfig{minPrevalence=" + minPrevalence
                + ", maxPredictions=" + maxPredictions
                + ", expectedPhenotypes=" + expectedPhenotypes
                + ", discriminativeQuestions=" + discriminativeQuestions
                + ", discriminativeMinAveragePrevalence=" + discriminativeMinAveragePrevalence + '}';
    }

    public static final class Builder {
        private double minPrevalence = DEFAULT_MIN_PREVALENCE;
        private int maxPredictions = DEFAULT_MAX_PREDICTIONS;
        private int expectedPhenotypes = DEFAULT_EXPECTED_PHENOTYPES;
        private int discriminativeQuestions = DEFAULT_DISCRIMINATIVE_QUESTIONS;
        private double discriminativeMinAveragePrevalence = DEFAULT_DISCRIMINATIVE_MIN_AVERAGE_PREVALENCE;

        private Builder() {
        }

        public Builder minPrevalence(double minPrevalence) {
            this.minPrevalence = minPrevalence;
            return this;
        }

        public Builder maxPredictions(int maxPredictions) {
            this.maxPredictions = maxPredictions;
            return this;
        }

        public Builder expectedPhenotypes(int expectedPhenotypes) {
            this.expectedPhenotypes = expectedPhenotypes;
            return this;
        }

        public Builder discriminativeQuestions(int discriminativeQuestions) {
            this.discriminativeQuestions = discriminativeQuestions;
            return this;
        }

        public Builder discriminativeMinAveragePrevalence(double discriminativeMinAveragePrevalence) {
            this.discriminativeMinAveragePrevalence = discriminativeMinAveragePrevalence;
            return this;
        }

        public PredictionConfig build() {
            if (maxPredictions < 0 || expectedPhenotypes < 0 || discriminativeQuestions < 0) {
                throw new IllegalArgumentException("Prediction list sizes must not be negative");
            }
            return new PredictionConfig(this);
        }
    }
}
