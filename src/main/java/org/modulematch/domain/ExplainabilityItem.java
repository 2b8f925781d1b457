package org.modulematch.domain;

import java.util.Locale;

/**
 * One itemized contribution (positive) or penalty (negative) behind a module score.
 */
public class ExplainabilityItem {
    private final String phenotypeId;
    private final String phenotypeName;
    private final double prevalence;
    private final double specificity;
    private final double contribution;
    private final String explanation;

    public ExplainabilityItem(String phenotypeId, String phenotypeName, double prevalence,
                              double specificity, double contribution, String explanation) {
        this.phenotypeId = phenotypeId;
        this.phenotypeName = phenotypeName;
        this.prevalence = prevalence;
        this.specificity = specificity;
        this.contribution = contribution;
        this.explanation = explanation;
    }

    public String getPhenotypeId() {
        return phenotypeId;
    }

    public String getPhenotypeName() {
        return phenotypeName;
    }

    public double getPrevalence() {
        return prevalence;
    }

    public double getSpecificity() {
        return specificity;
    }

    public double getContribution() {
        return contribution;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s %s %+.4f", phenotypeId, phenotypeName, contribution);
    }
}
