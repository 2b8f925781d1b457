package org.modulematch.domain;

import java.util.List;
import java.util.Locale;

/**
 * A gene ranked within a module by phenotype support and stability.
 */
public class GeneCandidate {
    private final String gene;
    private final int moduleId;
    private final double supportScore;
    private final double stabilityScore;
    private final StabilityClass classification;
    private final List<String> supportingPhenotypes;

    public GeneCandidate(String gene, int moduleId, double supportScore, double stabilityScore,
                         StabilityClass classification, List<String> supportingPhenotypes) {
        this.gene = gene;
        this.moduleId = moduleId;
        this.supportScore = supportScore;
        this.stabilityScore = stabilityScore;
        this.classification = classification;
        this.supportingPhenotypes = List.copyOf(supportingPhenotypes);
    }

    public String getGene() {
        return gene;
    }

    public int getModuleId() {
        return moduleId;
    }

    public double getSupportScore() {
        return supportScore;
    }

    public double getStabilityScore() {
        return stabilityScore;
    }

    public StabilityClass getClassification() {
        return classification;
    }

    /** Observed phenotype ids the gene itself is annotated with. */
    public List<String> getSupportingPhenotypes() {
        return supportingPhenotypes;
    }

    public boolean isSupported() {
        return !supportingPhenotypes.isEmpty();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s (%s, support: %.3f)", gene, classification, supportScore);
    }
}
