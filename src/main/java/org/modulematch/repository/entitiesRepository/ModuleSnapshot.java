package org.modulematch.repository.entitiesRepository;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.Gene;
import org.modulematch.domain.PhenotypeProfile;
import org.modulematch.domain.validation.SnapshotValidator;
import org.modulematch.domain.validation.ValidationException;
import org.modulematch.repository.EntityNotFoundException;
import org.modulematch.repository.PhenotypeIndex;
import org.modulematch.repository.interfaces.IModuleRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One immutable, fully validated set of module, gene and phenotype tables.
 * Safe to share between threads without synchronization.
 */
public final class ModuleSnapshot implements IModuleRepository {
    private static final Logger log = LogManager.getLogger(ModuleSnapshot.class);

    private final Map<Integer, DiseaseModule> modules;
    private final Map<String, Gene> genes;
    private final Map<Integer, List<Gene>> genesByModule;
    private final PhenotypeIndex phenotypeIndex;

    private ModuleSnapshot(Map<Integer, DiseaseModule> modules, Map<String, Gene> genes,
                           Map<Integer, List<Gene>> genesByModule, PhenotypeIndex phenotypeIndex) {
        this.modules = modules;
        this.genes = genes;
        this.genesByModule = genesByModule;
        this.phenotypeIndex = phenotypeIndex;
    }

    public static Builder builder(int moduleCount) {
        return new Builder(moduleCount);
    }

    @Override
    public DiseaseModule getModule(int moduleId) {
        DiseaseModule module = modules.get(moduleId);
        if (module == null) {
            throw new EntityNotFoundException("Module", moduleId);
        }
        return module;
    }

    @Override
    public Gene getGene(String symbol) {
        return findGene(symbol).orElseThrow(() -> new EntityNotFoundException("Gene", symbol));
    }

    @Override
    public Optional<Gene> findGene(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(genes.get(symbol));
    }

    @Override
    public Optional<String> resolvePhenotype(String text) {
        return phenotypeIndex.resolve(text);
    }

    @Override
    public Set<Integer> modulesContaining(String phenotypeId) {
        return phenotypeIndex.modulesContaining(phenotypeId);
    }

    @Override
    public List<Integer> getAllModuleIds() {
        return List.copyOf(modules.keySet());
    }

    @Override
    public List<DiseaseModule> getAllModules() {
        return List.copyOf(modules.values());
    }

    @Override
    public List<Gene> getModuleGenes(int moduleId) {
        getModule(moduleId);
        return genesByModule.getOrDefault(moduleId, List.of());
    }

    @Override
    public Map<String, String> phenotypeDisplayNames() {
        return phenotypeIndex.displayNames();
    }

    @Override
    public ModuleSnapshot snapshot() {
        return this;
    }

    public int getGeneCount() {
        return genes.size();
    }

    public int getPhenotypeCount() {
        return phenotypeIndex.size();
    }

    /**
     * Collects genes and per-module phenotype profiles, then validates them as a whole.
     * Not thread-safe; a builder is used by one loader at a time.
     */
    public static final class Builder {
        private final int moduleCount;
        private final Map<String, Gene> genes = new LinkedHashMap<>();
        private final Map<Integer, Map<String, PhenotypeProfile>> phenotypes = new TreeMap<>();

        private Builder(int moduleCount) {
            if (moduleCount <= 0) {
                throw new ValidationException("moduleCount must be positive: " + moduleCount);
            }
            this.moduleCount = moduleCount;
        }

        public Builder addGene(Gene gene) {
            SnapshotValidator.validateGene(gene, moduleCount);
            if (genes.putIfAbsent(gene.getSymbol(), gene) != null) {
                throw new ValidationException("Duplicate gene symbol: " + gene.getSymbol());
            }
            return this;
        }

        public Builder addPhenotype(int moduleId, PhenotypeProfile profile) {
            checkModuleId(moduleId);
            SnapshotValidator.validatePhenotype(moduleId, profile);
            Map<String, PhenotypeProfile> moduleProfiles = phenotypes.computeIfAbsent(moduleId, k -> new LinkedHashMap<>());
            if (moduleProfiles.putIfAbsent(profile.getPhenotypeId(), profile) != null) {
                throw new ValidationException("Module " + moduleId + " holds phenotype "
                        + profile.getPhenotypeId() + " more than once");
            }
            return this;
        }

        public ModuleSnapshot build() {
            Map<Integer, List<Gene>> genesByModule = new HashMap<>();
            for (Gene gene : genes.values()) {
                genesByModule.computeIfAbsent(gene.getModuleId(), k -> new ArrayList<>()).add(gene);
            }

            Map<Integer, DiseaseModule> modules = new LinkedHashMap<>();
            Map<Integer, List<Gene>> frozenGenes = new HashMap<>();
            for (int moduleId = 0; moduleId < moduleCount; moduleId++) {
                List<Gene> moduleGenes = genesByModule.getOrDefault(moduleId, new ArrayList<>());
                moduleGenes.sort((a, b) -> a.getSymbol().compareTo(b.getSymbol()));
                Set<String> symbols = moduleGenes.stream()
                        .map(Gene::getSymbol)
                        .collect(Collectors.toCollection(TreeSet::new));

                Map<String, PhenotypeProfile> profiles = phenotypes.getOrDefault(moduleId, Map.of());
                if (profiles.isEmpty()) {
                    log.warn("Module {} has no phenotype profiles", moduleId);
                }
                for (PhenotypeProfile profile : profiles.values()) {
                    Set<String> stray = SnapshotValidator.strayAnnotatedGenes(profile, symbols);
                    if (!stray.isEmpty()) {
                        log.warn("Module {}, phenotype {}: annotated genes not assigned to the module are ignored: {}",
                                moduleId, profile.getPhenotypeId(), stray);
                    }
                }

                modules.put(moduleId, new DiseaseModule(moduleId, profiles, symbols));
                frozenGenes.put(moduleId, List.copyOf(moduleGenes));
            }

            PhenotypeIndex index = PhenotypeIndex.build(modules.values());
            ModuleSnapshot snapshot = new ModuleSnapshot(
                    Collections.unmodifiableMap(modules),
                    Collections.unmodifiableMap(new LinkedHashMap<>(genes)),
                    Collections.unmodifiableMap(frozenGenes),
                    index);
            log.info("Built snapshot: {} modules, {} genes, {} unique phenotypes",
                    modules.size(), genes.size(), index.size());
            return snapshot;
        }

        private void checkModuleId(int moduleId) {
            if (moduleId < 0 || moduleId >= moduleCount) {
                throw new ValidationException("Module id " + moduleId + " outside configured range 0.." + (moduleCount - 1));
            }
        }
    }
}
