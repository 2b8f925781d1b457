package org.modulematch.domain;

/**
 * A disease gene and its assignment to exactly one module.
 */
public class Gene extends Entity<String> {
    private final int moduleId;
    private final double stabilityScore;
    private final StabilityClass classification;

    public Gene(String symbol, int moduleId, double stabilityScore, StabilityClass classification) {
        super(symbol);
        this.moduleId = moduleId;
        this.stabilityScore = stabilityScore;
        this.classification = classification;
    }

    public String getSymbol() {
        return getId();
    }

    public int getModuleId() {
        return moduleId;
    }

    public double getStabilityScore() {
        return stabilityScore;
    }

    public StabilityClass getClassification() {
        return classification;
    }

    @Override
    public String toString() {
        return getSymbol() + " (module " + moduleId + ", " + classification + ")";
    }
}
