package org.modulematch.service;

import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.interfaces.IClinicalSupportService;
import org.modulematch.service.interfaces.IGeneRankingService;
import org.modulematch.service.interfaces.IModuleScoringService;
import org.modulematch.service.interfaces.IPhenotypePredictionService;
import org.modulematch.session.InteractiveSession;

public class AllServices {
    private final IModuleRepository moduleRepository;
    private final IModuleScoringService moduleScoringService;
    private final IGeneRankingService geneRankingService;
    private final IPhenotypePredictionService phenotypePredictionService;
    private final IClinicalSupportService clinicalSupportService;
    private final ScoringConfig scoringConfig;
    private final PredictionConfig predictionConfig;

    public AllServices(IModuleRepository moduleRepository,
                       IModuleScoringService moduleScoringService,
                       IGeneRankingService geneRankingService,
                       IPhenotypePredictionService phenotypePredictionService,
                       IClinicalSupportService clinicalSupportService,
                       ScoringConfig scoringConfig,
                       PredictionConfig predictionConfig) {
        this.moduleRepository = moduleRepository;
        this.moduleScoringService = moduleScoringService;
        this.geneRankingService = geneRankingService;
        this.phenotypePredictionService = phenotypePredictionService;
        this.clinicalSupportService = clinicalSupportService;
        this.scoringConfig = scoringConfig;
        this.predictionConfig = predictionConfig;
    }

    public IModuleScoringService getModuleScoringService() {
        return moduleScoringService;
    }

    public IGeneRankingService getGeneRankingService() {
        return geneRankingService;
    }

    public IPhenotypePredictionService getPhenotypePredictionService() {
        return phenotypePredictionService;
    }

    public IClinicalSupportService getClinicalSupportService() {
        return clinicalSupportService;
    }

    /** Starts an empty question session; each caller gets its own. */
    public InteractiveSession newSession() {
        return new InteractiveSession(moduleRepository,
                tables -> SnapshotServices.bind(tables, scoringConfig, predictionConfig));
    }
}
