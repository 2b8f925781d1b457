package org.modulematch.domain;

import java.util.List;
import java.util.Set;

/**
 * Statistics of one phenotype inside one module.
 * Prevalence is the share of module genes annotated with the phenotype; specificity
 * is the share of all annotated genes that fall in this module. Both are percentages.
 */
public class PhenotypeProfile {
    private final String phenotypeId;
    private final String name;
    private final double prevalence;
    private final double specificity;
    private final Set<String> genesWith;
    private final List<String> genesWithout;
    private final List<String> nonTargetGenes;
    private final List<String> backgroundGenes;

    public PhenotypeProfile(String phenotypeId, String name, double prevalence, double specificity,
                            Set<String> genesWith, List<String> genesWithout,
                            List<String> nonTargetGenes, List<String> backgroundGenes) {
        this.phenotypeId = phenotypeId;
        this.name = name;
        this.prevalence = prevalence;
        this.specificity = specificity;
        this.genesWith = Set.copyOf(genesWith);
        this.genesWithout = List.copyOf(genesWithout);
        this.nonTargetGenes = List.copyOf(nonTargetGenes);
        this.backgroundGenes = List.copyOf(backgroundGenes);
    }

    public PhenotypeProfile(String phenotypeId, String name, double prevalence, double specificity,
                            Set<String> genesWith) {
        this(phenotypeId, name, prevalence, specificity, genesWith, List.of(), List.of(), List.of());
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

    /** Prevalence plus specificity, the raw weight behind contributions and penalties. */
    public double getCombinedWeight() {
        return prevalence + specificity;
    }

    public Set<String> getGenesWith() {
        return genesWith;
    }

    public boolean isAnnotated(String geneSymbol) {
        return genesWith.contains(geneSymbol);
    }

    public List<String> getGenesWithout() {
        return genesWithout;
    }

    public List<String> getNonTargetGenes() {
        return nonTargetGenes;
    }

    public List<String> getBackgroundGenes() {
        return backgroundGenes;
    }
}
