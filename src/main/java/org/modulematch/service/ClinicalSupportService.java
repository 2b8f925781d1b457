package org.modulematch.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.ExplainabilityItem;
import org.modulematch.domain.Gene;
import org.modulematch.domain.GeneCandidate;
import org.modulematch.domain.GeneQueryResult;
import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.ModuleRanking;
import org.modulematch.domain.ModuleSummary;
import org.modulematch.domain.NextQuestion;
import org.modulematch.domain.PhenotypePrediction;
import org.modulematch.domain.QueryResult;
import org.modulematch.domain.StabilityClass;
import org.modulematch.domain.validation.PhenotypeQueryValidator;
import org.modulematch.domain.validation.ValidationException;
import org.modulematch.repository.RepositoryException;
import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.interfaces.IClinicalSupportService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Implementation of the combined phenotype and gene query service.
 * Every call pins one snapshot of the tables and runs all steps against it.
 */
public class ClinicalSupportService implements IClinicalSupportService {
    private static final Logger log = LogManager.getLogger(ClinicalSupportService.class);

    private static final int SUMMARY_PHENOTYPES = 10;

    private static final Comparator<GeneCandidate> ALTERNATIVE_ORDER = Comparator
            .comparingDouble(GeneCandidate::getSupportScore).reversed()
            .thenComparing(Comparator.comparingDouble(GeneCandidate::getStabilityScore).reversed())
            .thenComparing(GeneCandidate::getGene);

    private final IModuleRepository repository;
    private final ScoringConfig scoringConfig;
    private final PredictionConfig predictionConfig;
    private final QueryConfig queryConfig;

    public ClinicalSupportService(IModuleRepository repository, ScoringConfig scoringConfig,
                                  PredictionConfig predictionConfig, QueryConfig queryConfig) {
        this.repository = repository;
        this.scoringConfig = scoringConfig;
        this.predictionConfig = predictionConfig;
        this.queryConfig = queryConfig;
    }

    @Override
    public QueryResult query(List<String> observed, List<String> excluded) throws ServicesException {
        try {
            PhenotypeQueryValidator.validateLabels(observed, "Observed");
            PhenotypeQueryValidator.validateLabels(excluded, "Excluded");

            SnapshotServices pinned = pin();
            ModuleRanking ranking = pinned.getScoring().rankModulesByLabels(nullToEmpty(observed), nullToEmpty(excluded));
            Set<String> observedIds = resolvedIds(pinned.getTables(), observed);
            Set<String> excludedIds = resolvedIds(pinned.getTables(), excluded);

            QueryResult.Builder result = QueryResult.builder()
                    .ranking(ranking)
                    .observedPhenotypes(new ArrayList<>(observedIds))
                    .excludedPhenotypes(new ArrayList<>(excludedIds))
                    .unmatchedInputs(ranking.getUnmatchedInputs());

            List<ModuleMatch> matches = ranking.getMatches();
            Optional<ModuleMatch> best = ranking.getBest();
            if (best.isPresent() && best.get().getScore() > 0) {
                int bestId = best.get().getModuleId();
                result.candidateGenes(pinned.getGenes().rankGenes(bestId, observedIds).stream()
                                .limit(queryConfig.getTopGenes())
                                .collect(Collectors.toList()))
                        .predictedPhenotypes(pinned.getPrediction().predictMissingPhenotypes(bestId, observedIds, excludedIds))
                        .explanation(explanation(best.get()));
            }

            result.alternativeGenes(alternativeGenes(pinned, matches, observedIds))
                    .discriminativeQuestions(pinned.getPrediction().discriminativeQuestions(matches, observedIds,
                            excludedIds, predictionConfig.getDiscriminativeQuestions()))
                    .nextQuestion(pinned.getPrediction().suggestNextQuestion(matches, observedIds, excludedIds));

            QueryResult built = result.build();
            log.info("Query with {} observed / {} excluded phenotypes ({} unmatched): best={}",
                    observedIds.size(), excludedIds.size(), built.getUnmatchedInputs().size(),
                    best.map(ModuleMatch::toString).orElse("none"));
            return built;
        } catch (ValidationException ve) {
            throw new ServicesException("Phenotype query validation failed: " + ve.getMessage(), ve);
        } catch (RepositoryException re) {
            log.error("Data provider failure while running phenotype query", re);
            throw new ServicesException("Error running phenotype query", re);
        }
    }

    @Override
    public Optional<GeneQueryResult> queryGene(String symbol) throws ServicesException {
        if (symbol == null || symbol.isBlank()) {
            throw new ServicesException("Gene symbol must not be blank");
        }
        try {
            SnapshotServices pinned = pin();
            Optional<Gene> found = pinned.getTables().findGene(symbol);
            if (found.isEmpty()) {
                log.info("Gene query for unknown symbol {}", symbol);
                return Optional.empty();
            }
            Gene gene = found.get();
            int moduleId = gene.getModuleId();

            List<GeneCandidate> moduleGenes = pinned.getTables().getModuleGenes(moduleId).stream()
                    .filter(g -> !g.getSymbol().equals(gene.getSymbol()))
                    .map(g -> new GeneCandidate(g.getSymbol(), moduleId, 0.0, g.getStabilityScore(),
                            g.getClassification(), List.of()))
                    .sorted(Comparator.comparingDouble(GeneCandidate::getStabilityScore).reversed()
                            .thenComparing(GeneCandidate::getGene))
                    .collect(Collectors.toList());

            List<PhenotypePrediction> characteristic = pinned.getPrediction().expectedPhenotypes(moduleId,
                    predictionConfig.getExpectedPhenotypes());

            return Optional.of(new GeneQueryResult(gene.getSymbol(), moduleId, gene.getStabilityScore(),
                    gene.getClassification(), moduleGenes, characteristic));
        } catch (RepositoryException re) {
            log.error("Data provider failure while querying gene {}", symbol, re);
            throw new ServicesException("Error querying gene: " + symbol, re);
        }
    }

    @Override
    public NextQuestion suggestNextPhenotype(List<String> observed, List<String> excluded) throws ServicesException {
        try {
            PhenotypeQueryValidator.validateLabels(observed, "Observed");
            PhenotypeQueryValidator.validateLabels(excluded, "Excluded");

            SnapshotServices pinned = pin();
            ModuleRanking ranking = pinned.getScoring().rankModulesByLabels(nullToEmpty(observed), nullToEmpty(excluded));
            return pinned.getPrediction().suggestNextQuestion(ranking.getMatches(),
                    resolvedIds(pinned.getTables(), observed), resolvedIds(pinned.getTables(), excluded));
        } catch (ValidationException ve) {
            throw new ServicesException("Phenotype query validation failed: " + ve.getMessage(), ve);
        } catch (RepositoryException re) {
            log.error("Data provider failure while suggesting next phenotype", re);
            throw new ServicesException("Error suggesting next phenotype", re);
        }
    }

    @Override
    public ModuleSummary moduleSummary(int moduleId) throws ServicesException {
        try {
            SnapshotServices pinned = pin();
            List<Gene> genes = pinned.getTables().getModuleGenes(moduleId);
            List<String> coreGenes = genes.stream()
                    .filter(g -> g.getClassification() == StabilityClass.CORE)
                    .map(Gene::getSymbol)
                    .sorted()
                    .collect(Collectors.toList());
            return new ModuleSummary(moduleId, genes.size(), coreGenes,
                    pinned.getPrediction().expectedPhenotypes(moduleId, SUMMARY_PHENOTYPES));
        } catch (RepositoryException re) {
            log.error("Error summarizing module {}", moduleId, re);
            throw new ServicesException("Error summarizing module: " + moduleId, re);
        }
    }

    /**
     * Best-supported genes across the runner-up modules that score above zero.
     */
    private List<GeneCandidate> alternativeGenes(SnapshotServices pinned, List<ModuleMatch> matches,
                                                 Set<String> observedIds) {
        if (matches.size() < 2) {
            return List.of();
        }
        List<GeneCandidate> alternatives = new ArrayList<>();
        int last = Math.min(matches.size(), 1 + queryConfig.getAlternativeModules());
        for (ModuleMatch match : matches.subList(1, last)) {
            if (match.getScore() > 0) {
                alternatives.addAll(pinned.getGenes().rankGenes(match.getModuleId(), observedIds));
            }
        }
        return alternatives.stream()
                .sorted(ALTERNATIVE_ORDER)
                .limit(queryConfig.getAlternativeGenes())
                .collect(Collectors.toList());
    }

    private static List<ExplainabilityItem> explanation(ModuleMatch best) {
        List<ExplainabilityItem> items = new ArrayList<>(best.getContributingPhenotypes());
        items.addAll(best.getPenalizedPhenotypes());
        items.sort(ModuleScoringService.EXPLANATION_ORDER);
        return items;
    }

    private static Set<String> resolvedIds(IModuleRepository tables, List<String> labels) {
        return ModuleScoringService.resolve(tables, labels, new ArrayList<>());
    }

    private static List<String> nullToEmpty(List<String> labels) {
        return labels == null ? List.of() : labels;
    }

    private SnapshotServices pin() {
        return SnapshotServices.bind(repository.snapshot(), scoringConfig, predictionConfig);
    }
}
