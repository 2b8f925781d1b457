package org.modulematch.domain;

import java.util.Locale;

/**
 * A phenotype expected in a module but not yet observed or excluded.
 */
public class PhenotypePrediction {
    private final String phenotypeId;
    private final String name;
    private final double prevalence;
    private final double specificity;
    private final String reason;

    public PhenotypePrediction(String phenotypeId, String name, double prevalence,
                               double specificity, String reason) {
        this.phenotypeId = phenotypeId;
        this.name = name;
        this.prevalence = prevalence;
        this.specificity = specificity;
        this.reason = reason;
    }

    public String getPhenotypeId() {
        return phenotypeId;
    }

    public String getName() {
        return name;
    }

    public double getPrevalence() {
        return prevalence;
    }

    public double getSpecificity() {
        return specificity;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s %s (prevalence: %.1f%%)", phenotypeId, name, prevalence);
    }
}
