package org.modulematch.service.interfaces;

import org.modulematch.domain.GeneCandidate;

import java.util.List;
import java.util.Set;

/**
 * Service interface for ranking the genes of one module.
 */
public interface IGeneRankingService {

    /**
     * Ranks every gene of the module. Genes supported by at least one observed phenotype
     * come first by score; unsupported genes follow, ordered by their stability
     * adjustment. Ties are broken by gene symbol.
     *
     * @param moduleId the module id
     * @param observed canonical ids of phenotypes present
     * @return all genes of the module
     * @throws org.modulematch.repository.EntityNotFoundException if the module is unknown
     */
    List<GeneCandidate> rankGenes(int moduleId, Set<String> observed);
}
