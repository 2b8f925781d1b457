package org.modulematch.domain;

import java.util.List;
import java.util.Locale;

/**
 * Score of one module against a phenotype query, with its explainability trail.
 */
public class ModuleMatch {
    private final int moduleId;
    private final double score;
    private final double confidence;
    private final int geneCount;
    private final List<ExplainabilityItem> contributingPhenotypes;
    private final List<ExplainabilityItem> penalizedPhenotypes;

    public ModuleMatch(int moduleId, double score, double confidence, int geneCount,
                       List<ExplainabilityItem> contributingPhenotypes,
                       List<ExplainabilityItem> penalizedPhenotypes) {
        this.moduleId = moduleId;
        this.score = score;
        this.confidence = confidence;
        this.geneCount = geneCount;
        this.contributingPhenotypes = List.copyOf(contributingPhenotypes);
        this.penalizedPhenotypes = List.copyOf(penalizedPhenotypes);
    }

    public ModuleMatch withConfidence(double newConfidence) {
        return new ModuleMatch(moduleId, score, newConfidence, geneCount,
                contributingPhenotypes, penalizedPhenotypes);
    }

    public int getModuleId() {
        return moduleId;
    }

    public double getScore() {
        return score;
    }

    /**
     * Relative separation from the other candidates. Not a probability, and not
     * bounded to [0,1] when the runner-up score is negative.
     */
    public double getConfidence() {
        return confidence;
    }

    public int getGeneCount() {
        return geneCount;
    }

    public List<ExplainabilityItem> getContributingPhenotypes() {
        return contributingPhenotypes;
    }

    public List<ExplainabilityItem> getPenalizedPhenotypes() {
        return penalizedPhenotypes;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Module %d: score=%.4f, confidence=%.4f, genes=%d",
                moduleId, score, confidence, geneCount);
    }
}
