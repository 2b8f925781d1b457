package org.modulematch.domain;

import java.util.List;

public class ModuleSummary {
    private final int moduleId;
    private final int totalGenes;
    private final List<String> coreGenes;
    private final List<PhenotypePrediction> topPhenotypes;

    public ModuleSummary(int moduleId, int totalGenes, List<String> coreGenes,
                         List<PhenotypePrediction> topPhenotypes) {
        this.moduleId = moduleId;
        this.totalGenes = totalGenes;
        this.coreGenes = List.copyOf(coreGenes);
        this.topPhenotypes = List.copyOf(topPhenotypes);
    }

    public int getModuleId() {
        return moduleId;
    }

    public int getTotalGenes() {
        return totalGenes;
    }

    public List<String> getCoreGenes() {
        return coreGenes;
    }

    public List<PhenotypePrediction> getTopPhenotypes() {
        return topPhenotypes;
    }
}
