package org.modulematch.domain;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Module context of a single gene.
 */
public class GeneQueryResult {
    private final String gene;
    private final int moduleId;
    private final double stabilityScore;
    private final StabilityClass classification;
    private final List<GeneCandidate> moduleGenes;
    private final List<PhenotypePrediction> characteristicPhenotypes;

    public GeneQueryResult(String gene, int moduleId, double stabilityScore, StabilityClass classification,
                           List<GeneCandidate> moduleGenes, List<PhenotypePrediction> characteristicPhenotypes) {
        this.gene = gene;
        this.moduleId = moduleId;
        this.stabilityScore = stabilityScore;
        this.classification = classification;
        this.moduleGenes = List.copyOf(moduleGenes);
        this.characteristicPhenotypes = List.copyOf(characteristicPhenotypes);
    }

    public String getGene() {
        return gene;
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

    /** The other genes of the module, most stable first. */
    public List<GeneCandidate> getModuleGenes() {
        return moduleGenes;
    }

    public List<PhenotypePrediction> getCharacteristicPhenotypes() {
        return characteristicPhenotypes;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Gene: ").append(gene).append(System.lineSeparator());
        sb.append("Module: ").append(moduleId).append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "Classification: %s (stability: %.3f)%n", classification, stabilityScore));

        List<String> coreGenes = moduleGenes.stream()
                .filter(g -> g.getClassification() == StabilityClass.CORE)
                .map(GeneCandidate::getGene)
                .limit(5)
                .collect(Collectors.toList());
        if (!coreGenes.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "%nCore genes in module: %s%n", String.join(", ", coreGenes)));
        }

        if (!characteristicPhenotypes.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "%nCharacteristic phenotypes:%n"));
            characteristicPhenotypes.stream().limit(5)
                    .forEach(p -> sb.append(String.format(Locale.ROOT, "  - %s (%.1f%%)%n", p.getName(), p.getPrevalence())));
        }
        return sb.toString().trim();
    }
}
