package org.modulematch.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * A phenotypically coherent cluster of disease genes.
 */
public class DiseaseModule extends Entity<Integer> {
    private final Map<String, PhenotypeProfile> phenotypes;
    private final Set<String> genes;

    public DiseaseModule(int moduleId, Map<String, PhenotypeProfile> phenotypes, Collection<String> genes) {
        super(moduleId);
        this.phenotypes = Collections.unmodifiableMap(new LinkedHashMap<>(phenotypes));
        this.genes = Collections.unmodifiableSet(new TreeSet<>(genes));
    }

    public int getModuleId() {
        return getId();
    }

    public Map<String, PhenotypeProfile> getPhenotypes() {
        return phenotypes;
    }

    public Optional<PhenotypeProfile> getPhenotype(String phenotypeId) {
        return Optional.ofNullable(phenotypes.get(phenotypeId));
    }

    public boolean hasPhenotype(String phenotypeId) {
        return phenotypes.containsKey(phenotypeId);
    }

    /** Gene symbols assigned to the module, in symbol order. */
    public Set<String> getGenes() {
        return genes;
    }

    public int getGeneCount() {
        return genes.size();
    }
}
