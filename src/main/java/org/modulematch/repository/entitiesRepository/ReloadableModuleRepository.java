package org.modulematch.repository.entitiesRepository;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.Gene;
import org.modulematch.repository.interfaces.IModuleRepository;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Repository over the current {@link ModuleSnapshot}. A new snapshot replaces the old
 * one in a single reference swap, so in-flight queries that pinned the old tables keep
 * reading them unchanged.
 */
public class ReloadableModuleRepository implements IModuleRepository {
    private static final Logger log = LogManager.getLogger(ReloadableModuleRepository.class);

    private final AtomicReference<ModuleSnapshot> current;

    public ReloadableModuleRepository(ModuleSnapshot initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial snapshot"));
    }

    /**
     * Publishes a new table set.
     *
     * @return the snapshot that was replaced
     */
    public ModuleSnapshot publish(ModuleSnapshot next) {
        ModuleSnapshot previous = current.getAndSet(Objects.requireNonNull(next, "next snapshot"));
        log.info("Published new module snapshot: {} modules, {} genes",
                next.getAllModuleIds().size(), next.getGeneCount());
        return previous;
    }

    @Override
    public ModuleSnapshot snapshot() {
        return current.get();
    }

    @Override
    public DiseaseModule getModule(int moduleId) {
        return current.get().getModule(moduleId);
    }

    @Override
    public Gene getGene(String symbol) {
        return current.get().getGene(symbol);
    }

    @Override
    public Optional<Gene> findGene(String symbol) {
        return current.get().findGene(symbol);
    }

    @Override
    public Optional<String> resolvePhenotype(String text) {
        return current.get().resolvePhenotype(text);
    }

    @Override
    public Set<Integer> modulesContaining(String phenotypeId) {
        return current.get().modulesContaining(phenotypeId);
    }

    @Override
    public List<Integer> getAllModuleIds() {
        return current.get().getAllModuleIds();
    }

    @Override
    public List<DiseaseModule> getAllModules() {
        return current.get().getAllModules();
    }

    @Override
    public List<Gene> getModuleGenes(int moduleId) {
        return current.get().getModuleGenes(moduleId);
    }

    @Override
    public Map<String, String> phenotypeDisplayNames() {
        return current.get().phenotypeDisplayNames();
    }
}
