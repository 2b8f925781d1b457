package org.modulematch.service;

import java.util.Properties;

/**
 * Weights used by module scoring and gene ranking.
 */
public final class ScoringConfig {
    public static final double DEFAULT_EXCLUSION_PENALTY = 0.5;
    public static final double DEFAULT_STABILITY_BONUS = 0.1;
    public static final double DEFAULT_STABILITY_PENALTY = 0.05;

    private final double exclusionPenalty;
    private final double stabilityBonus;
    private final double stabilityPenalty;

    private ScoringConfig(Builder builder) {
        this.exclusionPenalty = builder.exclusionPenalty;
        this.stabilityBonus = builder.stabilityBonus;
        this.stabilityPenalty = builder.stabilityPenalty;
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Reads {@code scoring.*} keys; absent keys keep their defaults. */
    public static ScoringConfig fromProperties(Properties properties) {
        return builder()
                .exclusionPenalty(ConfigProperties.getDouble(properties, "scoring.exclusionPenalty", DEFAULT_EXCLUSION_PENALTY))
                .stabilityBonus(ConfigProperties.getDouble(properties, "scoring.stabilityBonus", DEFAULT_STABILITY_BONUS))
                .stabilityPenalty(ConfigProperties.getDouble(properties, "scoring.stabilityPenalty", DEFAULT_STABILITY_PENALTY))
                .build();
    }

    /** Multiplier applied to the weight of an excluded phenotype. */
    public double getExclusionPenalty() {
        return exclusionPenalty;
    }

    /** Added to the score of core genes. */
    public double getStabilityBonus() {
        return stabilityBonus;
    }

    /** Subtracted from the score of unstable genes. */
    public double getStabilityPenalty() {
        return stabilityPenalty;
    }

    @Override
    public String toString() {
        return "ScoringConfig{exclusionPenalty=" + exclusionPenalty
                + ", stabilityBonus=" + stabilityBonus
                + ", stabilityPenalty=" + stabilityPenalty + '}';
    }

    public static final class Builder {
        private double exclusionPenalty = DEFAULT_EXCLUSION_PENALTY;
        private double stabilityBonus = DEFAULT_STABILITY_BONUS;
        private double stabilityPenalty = DEFAULT_STABILITY_PENALTY;

        private Builder() {
        }

        public Builder exclusionPenalty(double exclusionPenalty) {
            this.exclusionPenalty = exclusionPenalty;
            return this;
        }

        public Builder stabilityBonus(double stabilityBonus) {
            this.stabilityBonus = stabilityBonus;
            return this;
        }

        public Builder stabilityPenalty(double stabilityPenalty) {
            this.stabilityPenalty = stabilityPenalty;
            return this;
        }

        public ScoringConfig build() {
            if (exclusionPenalty < 0 || stabilityBonus < 0 || stabilityPenalty < 0) {
                throw new IllegalArgumentException("Scoring weights must not be negative");
            }
            return new ScoringConfig(this);
        }
    }
}
