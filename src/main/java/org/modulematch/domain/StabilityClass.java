package org.modulematch.domain;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;
import java.util.Optional;

/**
 * Clustering confidence of a gene within its assigned module.
 */
public enum StabilityClass {
    @SerializedName("core")
    CORE("core"),
    @SerializedName("peripheral")
    PERIPHERAL("peripheral"),
    @SerializedName("unstable")
    UNSTABLE("unstable");

    private final String label;

    StabilityClass(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Classifies a stability score against the provider's thresholds.
     *
     * @param stabilityScore score in [0,1]
     * @param coreThreshold scores at or above this are core
     * @param unstableThreshold scores below this are unstable
     */
    public static StabilityClass fromScore(double stabilityScore, double coreThreshold, double unstableThreshold) {
        if (stabilityScore >= coreThreshold) {
            return CORE;
        }
        if (stabilityScore < unstableThreshold) {
            return UNSTABLE;
        }
        return PERIPHERAL;
    }

    public static Optional<StabilityClass> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (StabilityClass value : values()) {
            if (value.label.equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
