package org.modulematch.service.interfaces;

import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.ModuleRanking;

import java.util.Collection;
import java.util.Set;

/**
 * Service interface for ranking disease modules against a phenotype query.
 */
public interface IModuleScoringService {

    /**
     * Scores and ranks every module.
     *
     * @param observed canonical ids of phenotypes present
     * @param excluded canonical ids of phenotypes absent; disjoint from {@code observed}
     * @return all modules by score descending, ties by ascending module id
     * @throws org.modulematch.domain.validation.ValidationException if the two sets overlap
     */
    ModuleRanking rankModules(Set<String> observed, Set<String> excluded);

    /**
     * Resolves raw labels (names or ids) first. Labels that match nothing are reported
     * in {@link ModuleRanking#getUnmatchedInputs()} and take no part in scoring.
     *
     * @param observedLabels labels of phenotypes present
     * @param excludedLabels labels of phenotypes absent
     * @return the ranking over the labels that did resolve
     */
    ModuleRanking rankModulesByLabels(Collection<String> observedLabels, Collection<String> excludedLabels);

    /**
     * Scores one module without ranking; confidence is left at 0.
     *
     * @param moduleId the module id
     * @param observed canonical ids of phenotypes present
     * @param excluded canonical ids of phenotypes absent
     * @return the module's score and explainability trail
     */
    ModuleMatch scoreModule(int moduleId, Set<String> observed, Set<String> excluded);
}
