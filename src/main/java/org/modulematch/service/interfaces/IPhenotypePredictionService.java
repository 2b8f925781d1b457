package org.modulematch.service.interfaces;

import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.NextQuestion;
import org.modulematch.domain.PhenotypePrediction;

import java.util.List;
import java.util.Set;

/**
 * Service interface for expected-phenotype prediction and question selection.
 */
public interface IPhenotypePredictionService {

    /**
     * Phenotypes of the module that are neither observed nor excluded and whose
     * prevalence reaches the configured minimum.
     *
     * @param moduleId the module id
     * @param observed canonical ids of phenotypes present
     * @param excluded canonical ids of phenotypes absent
     * @param topN maximum number of predictions
     * @return predictions by prevalence, then specificity descending, then id
     */
    List<PhenotypePrediction> predictMissingPhenotypes(int moduleId, Set<String> observed,
                                                       Set<String> excluded, int topN);

    /**
     * Same as {@link #predictMissingPhenotypes(int, Set, Set, int)} with the configured default size.
     */
    List<PhenotypePrediction> predictMissingPhenotypes(int moduleId, Set<String> observed, Set<String> excluded);

    /**
     * The most characteristic phenotypes of a module, by prevalence × specificity.
     *
     * @param moduleId the module id
     * @param topN maximum number of phenotypes
     * @return characteristic phenotypes
     */
    List<PhenotypePrediction> expectedPhenotypes(int moduleId, int topN);

    /**
     * Picks the phenotype that would most widen the gap between the top module and the
     * runner-up if it were observed.
     *
     * @param rankedModules modules as ranked for the current query
     * @param observed canonical ids already observed
     * @param excluded canonical ids already excluded or otherwise not to be asked again
     * @return the question, or {@link NextQuestion#none()} when nothing is left to ask
     */
    NextQuestion suggestNextQuestion(List<ModuleMatch> rankedModules, Set<String> observed, Set<String> excluded);

    /**
     * Top-module phenotypes whose prevalence differs most from the runner-up.
     *
     * @param rankedModules modules as ranked for the current query
     * @param observed canonical ids already observed
     * @param excluded canonical ids already excluded
     * @param topN maximum number of questions
     * @return questions by discriminating power; empty when the runner-up does not score above 0
     */
    List<PhenotypePrediction> discriminativeQuestions(List<ModuleMatch> rankedModules, Set<String> observed,
                                                      Set<String> excluded, int topN);
}
