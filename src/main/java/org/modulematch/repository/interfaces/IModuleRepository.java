package org.modulematch.repository.interfaces;

import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.Gene;
import org.modulematch.repository.EntityNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the module, gene and phenotype tables.
 */
public interface IModuleRepository {

    /**
     * @param moduleId module id within the configured range
     * @return the module
     * @throws EntityNotFoundException if the id is outside the configured module set
     */
    DiseaseModule getModule(int moduleId);

    /**
     * Case-sensitive lookup on the canonical gene symbol.
     *
     * @throws EntityNotFoundException if the symbol is not in the gene universe
     */
    Gene getGene(String symbol);

    Optional<Gene> findGene(String symbol);

    /**
     * Resolves a phenotype name (case-insensitive) or canonical id.
     *
     * @return the canonical id, or empty when the text matches nothing
     */
    Optional<String> resolvePhenotype(String text);

    /** Ids of the modules whose profile contains the phenotype. */
    Set<Integer> modulesContaining(String phenotypeId);

    /** All configured module ids, ascending. */
    List<Integer> getAllModuleIds();

    List<DiseaseModule> getAllModules();

    /**
     * Genes assigned to a module, in symbol order.
     *
     * @throws EntityNotFoundException if the id is outside the configured module set
     */
    List<Gene> getModuleGenes(int moduleId);

    /** Display label {@code "Name (ID)"} to canonical id, sorted by label. */
    Map<String, String> phenotypeDisplayNames();

    /**
     * The immutable table set currently backing this repository. Callers that issue
     * several reads for one query pin it so that all reads see the same tables.
     */
    IModuleRepository snapshot();
}
