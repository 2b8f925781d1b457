package org.modulematch.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.ExplainabilityItem;
import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.ModuleRanking;
import org.modulematch.domain.PhenotypeProfile;
import org.modulematch.domain.validation.PhenotypeQueryValidator;
import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.interfaces.IModuleScoringService;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scores modules as a weighted sum over observed and excluded phenotypes and ranks them.
 */
public class ModuleScoringService implements IModuleScoringService {
    private static final Logger log = LogManager.getLogger(ModuleScoringService.class);

    static final Comparator<ModuleMatch> RANKING_ORDER = Comparator
            .comparingDouble(ModuleMatch::getScore).reversed()
            .thenComparingInt(ModuleMatch::getModuleId);

    /** Largest absolute contribution first, then phenotype id. */
    public static final Comparator<ExplainabilityItem> EXPLANATION_ORDER = Comparator
            .comparingDouble((ExplainabilityItem item) -> Math.abs(item.getContribution())).reversed()
            .thenComparing(ExplainabilityItem::getPhenotypeId);

    private final IModuleRepository repository;
    private final ScoringConfig config;

    public ModuleScoringService(IModuleRepository repository, ScoringConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @Override
    public ModuleRanking rankModules(Set<String> observed, Set<String> excluded) {
        return rank(repository.snapshot(), observed, excluded, List.of());
    }

    @Override
    public ModuleRanking rankModulesByLabels(Collection<String> observedLabels, Collection<String> excludedLabels) {
        IModuleRepository tables = repository.snapshot();
        List<String> unmatched = new ArrayList<>();
        Set<String> observed = resolve(tables, observedLabels, unmatched);
        Set<String> excluded = resolve(tables, excludedLabels, unmatched);
        if (!unmatched.isEmpty()) {
            log.warn("Unmatched phenotype inputs excluded from scoring: {}", unmatched);
        }
        return rank(tables, observed, excluded, unmatched);
    }

    @Override
    public ModuleMatch scoreModule(int moduleId, Set<String> observed, Set<String> excluded) {
        PhenotypeQueryValidator.validateDisjoint(observed, excluded);
        return score(repository.snapshot().getModule(moduleId), new TreeSet<>(observed), new TreeSet<>(excluded));
    }

    /**
     * Resolves labels in input order; labels that match nothing go to {@code unmatched}.
     */
    static Set<String> resolve(IModuleRepository tables, Collection<String> labels, List<String> unmatched) {
        Set<String> resolved = new LinkedHashSet<>();
        if (labels == null) {
            return resolved;
        }
        for (String label : labels) {
            Optional<String> id = tables.resolvePhenotype(label);
            if (id.isPresent()) {
                resolved.add(id.get());
            } else {
                unmatched.add(label);
            }
        }
        return resolved;
    }

    private ModuleRanking rank(IModuleRepository tables, Set<String> observed, Set<String> excluded,
                               List<String> unmatched) {
        PhenotypeQueryValidator.validateDisjoint(observed, excluded);

        // sorted iteration keeps the floating-point summation order fixed
        SortedSet<String> sortedObserved = new TreeSet<>(observed);
        SortedSet<String> sortedExcluded = new TreeSet<>(excluded);

        List<ModuleMatch> matches = new ArrayList<>();
        for (int moduleId : tables.getAllModuleIds()) {
            matches.add(score(tables.getModule(moduleId), sortedObserved, sortedExcluded));
        }
        matches.sort(RANKING_ORDER);

        double confidence = confidence(matches);
        List<ModuleMatch> ranked = new ArrayList<>(matches.size());
        for (int i = 0; i < matches.size(); i++) {
            ModuleMatch match = matches.get(i);
            ranked.add(match.withConfidence(i == 0 ? confidence : relativeConfidence(match, matches.get(0), confidence)));
        }

        if (log.isDebugEnabled() && !ranked.isEmpty()) {
            log.debug("Ranked {} modules for {} observed / {} excluded phenotypes; top={} confidence={}",
                    ranked.size(), observed.size(), excluded.size(), ranked.get(0), confidence);
        }
        return new ModuleRanking(ranked, confidence, unmatched);
    }

    private ModuleMatch score(DiseaseModule module, SortedSet<String> observed, SortedSet<String> excluded) {
        double score = 0.0;
        List<ExplainabilityItem> contributing = new ArrayList<>();
        List<ExplainabilityItem> penalized = new ArrayList<>();

        for (String phenotypeId : observed) {
            Optional<PhenotypeProfile> profile = module.getPhenotype(phenotypeId);
            if (profile.isEmpty()) {
                continue;
            }
            PhenotypeProfile p = profile.get();
            double contribution = PhenotypeWeights.contribution(p);
            score += contribution;
            contributing.add(new ExplainabilityItem(phenotypeId, p.getName(), p.getPrevalence(), p.getSpecificity(),
                    contribution, String.format(Locale.ROOT,
                    "Present in module (prevalence: %.1f%%, specificity: %.1f%%)", p.getPrevalence(), p.getSpecificity())));
        }

        for (String phenotypeId : excluded) {
            Optional<PhenotypeProfile> profile = module.getPhenotype(phenotypeId);
            if (profile.isEmpty()) {
                continue;
            }
            PhenotypeProfile p = profile.get();
            double penalty = PhenotypeWeights.penalty(p, config.getExclusionPenalty());
            score -= penalty;
            penalized.add(new ExplainabilityItem(phenotypeId, p.getName(), p.getPrevalence(), p.getSpecificity(),
                    -penalty, String.format(Locale.ROOT,
                    "Excluded but present in module (prevalence: %.1f%%)", p.getPrevalence())));
        }

        contributing.sort(EXPLANATION_ORDER);
        penalized.sort(EXPLANATION_ORDER);
        // + 0.0 folds a negative zero into 0.0 so it cannot sort below other zero scores
        return new ModuleMatch(module.getModuleId(), score + 0.0, 0.0, module.getGeneCount(), contributing, penalized);
    }

    /**
     * (score1 - score2) / score1 when score1 is positive, otherwise 0. Not
     * clamped: a negative runner-up pushes the value above 1.
     */
    static double confidence(List<ModuleMatch> ranked) {
        if (ranked.isEmpty()) {
            return 0.0;
        }
        double top = ranked.get(0).getScore();
        if (top <= 0) {
            return 0.0;
        }
        double second = ranked.size() > 1 ? ranked.get(1).getScore() : 0.0;
        return (top - second) / top;
    }

    private static double relativeConfidence(ModuleMatch match, ModuleMatch top, double topConfidence) {
        if (top.getScore() <= 0) {
            return 0.0;
        }
        return match.getScore() / top.getScore() * (1 - topConfidence);
    }
}
