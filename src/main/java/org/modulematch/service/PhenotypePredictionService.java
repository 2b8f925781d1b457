package org.modulematch.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.NextQuestion;
import org.modulematch.domain.PhenotypePrediction;
import org.modulematch.domain.PhenotypeProfile;
import org.modulematch.domain.validation.PhenotypeQueryValidator;
import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.interfaces.IPhenotypePredictionService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Predicts expected-but-unobserved phenotypes and chooses which phenotype to ask about next.
 */
public class PhenotypePredictionService implements IPhenotypePredictionService {
    private static final Logger log = LogManager.getLogger(PhenotypePredictionService.class);

    static final Comparator<PhenotypeProfile> PREVALENCE_ORDER = Comparator
            .comparingDouble(PhenotypeProfile::getPrevalence).reversed()
            .thenComparing(Comparator.comparingDouble(PhenotypeProfile::getSpecificity).reversed())
            .thenComparing(PhenotypeProfile::getPhenotypeId);

    private static final Comparator<PhenotypeProfile> CHARACTERISTIC_ORDER = Comparator
            .comparingDouble(PhenotypePredictionService::characteristicScore).reversed()
            .thenComparing(PhenotypeProfile::getPhenotypeId);

    private static final double WEIGHT_TOLERANCE = 1e-9;

    private final IModuleRepository repository;
    private final PredictionConfig config;

    public PhenotypePredictionService(IModuleRepository repository, PredictionConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @Override
    public List<PhenotypePrediction> predictMissingPhenotypes(int moduleId, Set<String> observed,
                                                              Set<String> excluded, int topN) {
        PhenotypeQueryValidator.validateTopN(topN);
        DiseaseModule module = repository.snapshot().getModule(moduleId);
        Set<String> asked = union(observed, excluded);

        return module.getPhenotypes().values().stream()
                .filter(p -> !asked.contains(p.getPhenotypeId()))
                .filter(p -> p.getPrevalence() >= config.getMinPrevalence())
                .sorted(PREVALENCE_ORDER)
                .limit(topN)
                .map(p -> toPrediction(p, describe(p)))
                .collect(Collectors.toList());
    }

    @Override
    public List<PhenotypePrediction> predictMissingPhenotypes(int moduleId, Set<String> observed, Set<String> excluded) {
        return predictMissingPhenotypes(moduleId, observed, excluded, config.getMaxPredictions());
    }

    @Override
    public List<PhenotypePrediction> expectedPhenotypes(int moduleId, int topN) {
        PhenotypeQueryValidator.validateTopN(topN);
        DiseaseModule module = repository.snapshot().getModule(moduleId);
        return module.getPhenotypes().values().stream()
                .sorted(CHARACTERISTIC_ORDER)
                .limit(topN)
                .map(p -> toPrediction(p, describe(p)))
                .collect(Collectors.toList());
    }

    @Override
    public NextQuestion suggestNextQuestion(List<ModuleMatch> rankedModules, Set<String> observed, Set<String> excluded) {
        if (rankedModules == null || rankedModules.isEmpty()) {
            return NextQuestion.none();
        }
        IModuleRepository tables = repository.snapshot();
        Set<String> asked = union(observed, excluded);

        if (rankedModules.size() >= 2) {
            Optional<NextQuestion> discriminating = selectDiscriminating(tables, rankedModules.get(0),
                    rankedModules.get(1), asked);
            if (discriminating.isPresent()) {
                log.debug("Next question {} widens the gap to {}", discriminating.get(),
                        discriminating.get().getHypotheticalGap());
                return discriminating.get();
            }
        }

        for (ModuleMatch match : rankedModules) {
            Optional<PhenotypeProfile> fallback = tables.getModule(match.getModuleId()).getPhenotypes().values().stream()
                    .filter(p -> !asked.contains(p.getPhenotypeId()))
                    .min(PREVALENCE_ORDER);
            if (fallback.isPresent()) {
                PhenotypeProfile p = fallback.get();
                log.debug("No shared discriminating phenotype; falling back to {} from module {}",
                        p.getPhenotypeId(), match.getModuleId());
                return NextQuestion.fallback(toPrediction(p,
                        String.format(Locale.ROOT, "Most prevalent open phenotype of Module %d (%.0f%% of genes)",
                                match.getModuleId(), p.getPrevalence())));
            }
        }
        log.debug("No further question available");
        return NextQuestion.none();
    }

    /**
     * Searches the union of the two modules' open phenotypes for the one maximising
     * (score1 + c1) - (score2 + c2). Only applies when the modules share an open phenotype.
     */
    private Optional<NextQuestion> selectDiscriminating(IModuleRepository tables, ModuleMatch topMatch,
                                                        ModuleMatch secondMatch, Set<String> asked) {
        DiseaseModule top = tables.getModule(topMatch.getModuleId());
        DiseaseModule second = tables.getModule(secondMatch.getModuleId());

        Set<String> openTop = openPhenotypes(top, asked);
        Set<String> openSecond = openPhenotypes(second, asked);
        Set<String> shared = new HashSet<>(openTop);
        shared.retainAll(openSecond);
        if (shared.isEmpty()) {
            return Optional.empty();
        }

        Set<String> candidates = new TreeSet<>(openTop);
        candidates.addAll(openSecond);

        // Both scores are the same for every candidate, so candidates are compared on the
        // percent-scale weight difference alone and the scores are added back for reporting.
        String bestId = null;
        double bestDelta = 0.0;
        double bestCombined = 0.0;
        for (String phenotypeId : candidates) {
            double combined = top.getPhenotype(phenotypeId).map(PhenotypeProfile::getCombinedWeight).orElse(0.0);
            double delta = combined
                    - second.getPhenotype(phenotypeId).map(PhenotypeProfile::getCombinedWeight).orElse(0.0);

            // candidates iterate in id order, so strict comparisons keep the lowest id on full ties
            boolean sameDelta = Math.abs(delta - bestDelta) <= WEIGHT_TOLERANCE;
            if (bestId == null || (!sameDelta && delta > bestDelta) || (sameDelta && combined > bestCombined)) {
                bestId = phenotypeId;
                bestDelta = delta;
                bestCombined = combined;
            }
        }
        double bestGap = topMatch.getScore() - secondMatch.getScore() + PhenotypeWeights.contribution(bestDelta);

        Optional<PhenotypeProfile> inTop = top.getPhenotype(bestId);
        Optional<PhenotypeProfile> inSecond = second.getPhenotype(bestId);
        PhenotypeProfile profile = inTop.orElseGet(inSecond::get);
        String reason = String.format(Locale.ROOT, "%.0f%% of Module %d VS %.0f%% in Module %d",
                inTop.map(PhenotypeProfile::getPrevalence).orElse(0.0), top.getModuleId(),
                inSecond.map(PhenotypeProfile::getPrevalence).orElse(0.0), second.getModuleId());
        return Optional.of(NextQuestion.discriminating(toPrediction(profile, reason), bestGap));
    }

    @Override
    public List<PhenotypePrediction> discriminativeQuestions(List<ModuleMatch> rankedModules, Set<String> observed,
                                                             Set<String> excluded, int topN) {
        PhenotypeQueryValidator.validateTopN(topN);
        if (rankedModules == null || rankedModules.size() < 2) {
            return List.of();
        }
        ModuleMatch topMatch = rankedModules.get(0);
        ModuleMatch secondMatch = rankedModules.get(1);
        if (secondMatch.getScore() <= 0) {
            return List.of();
        }

        IModuleRepository tables = repository.snapshot();
        DiseaseModule top = tables.getModule(topMatch.getModuleId());
        DiseaseModule second = tables.getModule(secondMatch.getModuleId());
        Set<String> asked = union(observed, excluded);

        List<ScoredQuestion> scored = new ArrayList<>();
        for (PhenotypeProfile profile : top.getPhenotypes().values()) {
            if (asked.contains(profile.getPhenotypeId())) {
                continue;
            }
            double topPrevalence = profile.getPrevalence();
            double secondPrevalence = second.getPhenotype(profile.getPhenotypeId())
                    .map(PhenotypeProfile::getPrevalence).orElse(0.0);
            double average = (topPrevalence + secondPrevalence) / 2.0;
            if (average < config.getDiscriminativeMinAveragePrevalence()) {
                continue;
            }
            double weight = Math.abs(topPrevalence - secondPrevalence) * (average / 100.0);
            String reason = String.format(Locale.ROOT, "%.0f%% of Module %d VS %.0f%% in Module %d",
                    topPrevalence, top.getModuleId(), secondPrevalence, second.getModuleId());
            scored.add(new ScoredQuestion(weight, toPrediction(profile, reason)));
        }

        return scored.stream()
                .sorted(Comparator.comparingDouble(ScoredQuestion::weight).reversed()
                        .thenComparing(q -> q.prediction().getPhenotypeId()))
                .limit(topN)
                .map(ScoredQuestion::prediction)
                .collect(Collectors.toList());
    }

    static String describe(PhenotypeProfile p) {
        if (p.getPrevalence() >= 80) {
            return String.format(Locale.ROOT, "Very common in module (%.0f%% of genes)", p.getPrevalence());
        } else if (p.getPrevalence() >= 50) {
            return String.format(Locale.ROOT, "Common in module (%.0f%% of genes)", p.getPrevalence());
        } else if (p.getSpecificity() >= 50) {
            return String.format(Locale.ROOT, "Highly specific to module (%.0f%% of genes with phenotype are in module)",
                    p.getSpecificity());
        }
        return String.format(Locale.ROOT, "Characteristic (prevalence: %.0f%%, specificity: %.0f%%)",
                p.getPrevalence(), p.getSpecificity());
    }

    private static double characteristicScore(PhenotypeProfile p) {
        return p.getPrevalence() * p.getSpecificity() / 100.0;
    }

    private static PhenotypePrediction toPrediction(PhenotypeProfile p, String reason) {
        return new PhenotypePrediction(p.getPhenotypeId(), p.getName(), p.getPrevalence(), p.getSpecificity(), reason);
    }

    private static Set<String> openPhenotypes(DiseaseModule module, Set<String> asked) {
        Set<String> open = new HashSet<>(module.getPhenotypes().keySet());
        open.removeAll(asked);
        return open;
    }

    private static Set<String> union(Set<String> observed, Set<String> excluded) {
        Set<String> asked = new HashSet<>();
        if (observed != null) {
            asked.addAll(observed);
        }
        if (excluded != null) {
            asked.addAll(excluded);
        }
        return asked;
    }

    private static final class ScoredQuestion {
        private final double weight;
        private final PhenotypePrediction prediction;

        private ScoredQuestion(double weight, PhenotypePrediction prediction) {
            this.weight = weight;
            this.prediction = prediction;
        }

        double weight() {
            return weight;
        }

        PhenotypePrediction prediction() {
            return prediction;
        }
    }
}
