package org.modulematch.service;

import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.interfaces.IGeneRankingService;
import org.modulematch.service.interfaces.IModuleScoringService;
import org.modulematch.service.interfaces.IPhenotypePredictionService;

/**
 * Scoring, gene ranking and prediction services bound to one pinned snapshot of the tables.
 * Everything computed through one instance reads the same tables even if a new snapshot
 * is published meanwhile.
 */
public class SnapshotServices {
    private final IModuleRepository tables;
    private final IModuleScoringService scoring;
    private final IGeneRankingService genes;
    private final IPhenotypePredictionService prediction;

    public SnapshotServices(IModuleRepository tables, IModuleScoringService scoring,
                            IGeneRankingService genes, IPhenotypePredictionService prediction) {
        this.tables = tables;
        this.scoring = scoring;
        this.genes = genes;
        this.prediction = prediction;
    }

    public static SnapshotServices bind(IModuleRepository tables, ScoringConfig scoringConfig,
                                        PredictionConfig predictionConfig) {
        return new SnapshotServices(tables,
                new ModuleScoringService(tables, scoringConfig),
                new GeneRankingService(tables, scoringConfig),
                new PhenotypePredictionService(tables, predictionConfig));
    }

    public IModuleRepository getTables() {
        return tables;
    }

    public IModuleScoringService getScoring() {
        return scoring;
    }

    public IGeneRankingService getGenes() {
        return genes;
    }

    public IPhenotypePredictionService getPrediction() {
        return prediction;
    }
}
