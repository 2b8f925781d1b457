package org.modulematch.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.DiseaseModule;
import org.modulematch.domain.Gene;
import org.modulematch.domain.GeneCandidate;
import org.modulematch.domain.PhenotypeProfile;
import org.modulematch.domain.StabilityClass;
import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.interfaces.IGeneRankingService;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ranks the genes of a module by observed-phenotype support plus a stability adjustment.
 */
public class GeneRankingService implements IGeneRankingService {
    private static final Logger log = LogManager.getLogger(GeneRankingService.class);

    static final Comparator<GeneCandidate> RANKING_ORDER = Comparator
            .comparing(GeneCandidate::isSupported).reversed()
            .thenComparing(Comparator.comparingDouble(GeneCandidate::getSupportScore).reversed())
            .thenComparing(GeneCandidate::getGene);

    private final IModuleRepository repository;
    private final ScoringConfig config;

    public GeneRankingService(IModuleRepository repository, ScoringConfig config) {
        this.repository = repository;
        this.config = config;
    }

    @Override
    public List<GeneCandidate> rankGenes(int moduleId, Set<String> observed) {
        IModuleRepository tables = repository.snapshot();
        DiseaseModule module = tables.getModule(moduleId);

        List<PhenotypeProfile> observedProfiles = new ArrayList<>();
        for (String phenotypeId : new TreeSet<>(observed)) {
            module.getPhenotype(phenotypeId).ifPresent(observedProfiles::add);
        }

        List<GeneCandidate> candidates = new ArrayList<>();
        for (String symbol : module.getGenes()) {
            Gene gene = tables.getGene(symbol);
            double support = 0.0;
            List<String> supporting = new ArrayList<>();
            for (PhenotypeProfile profile : observedProfiles) {
                if (profile.isAnnotated(symbol)) {
                    support += PhenotypeWeights.contribution(profile);
                    supporting.add(profile.getPhenotypeId());
                }
            }
            double score = support + stabilityAdjustment(gene.getClassification());
            candidates.add(new GeneCandidate(symbol, moduleId, score, gene.getStabilityScore(),
                    gene.getClassification(), supporting));
        }

        candidates.sort(RANKING_ORDER);
        log.debug("Ranked {} genes in module {} against {} observed phenotypes",
                candidates.size(), moduleId, observedProfiles.size());
        return candidates;
    }

    double stabilityAdjustment(StabilityClass classification) {
        return switch (classification) {
            case CORE -> config.getStabilityBonus();
            case UNSTABLE -> -config.getStabilityPenalty();
            case PERIPHERAL -> 0.0;
        };
    }
}
