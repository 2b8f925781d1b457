package org.modulematch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.repository.entitiesRepository.ModuleSnapshot;
import org.modulematch.repository.entitiesRepository.ModuleSnapshotLoader;
import org.modulematch.repository.entitiesRepository.ReloadableModuleRepository;
import org.modulematch.service.AllServices;
import org.modulematch.service.ClinicalSupportService;
import org.modulematch.service.GeneRankingService;
import org.modulematch.service.ModuleScoringService;
import org.modulematch.service.PhenotypePredictionService;
import org.modulematch.service.PredictionConfig;
import org.modulematch.service.QueryConfig;
import org.modulematch.service.ScoringConfig;
import org.modulematch.service.interfaces.IClinicalSupportService;
import org.modulematch.service.interfaces.IGeneRankingService;
import org.modulematch.service.interfaces.IModuleScoringService;
import org.modulematch.service.interfaces.IPhenotypePredictionService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Configuration
public class ModuleMatchConfig {
    private static final Logger log = LogManager.getLogger(ModuleMatchConfig.class);

    static final String CONFIG_RESOURCE = "engine.config";

    @Bean(name = "engineProperties")
    Properties getProperties() {
        Properties properties = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Configuration file " + CONFIG_RESOURCE + " not found");
            }
            properties.load(in);
        } catch (IOException e) {
            log.error("Failed to load {}", CONFIG_RESOURCE, e);
            throw new IllegalStateException("Configuration file " + CONFIG_RESOURCE + " could not be read", e);
        }
        return properties;
    }

    @Bean
    public ScoringConfig scoringConfig(@Qualifier("engineProperties") Properties properties) {
        return ScoringConfig.fromProperties(properties);
    }

    @Bean
    public PredictionConfig predictionConfig(@Qualifier("engineProperties") Properties properties) {
        return PredictionConfig.fromProperties(properties);
    }

    @Bean
    public QueryConfig queryConfig(@Qualifier("engineProperties") Properties properties) {
        return QueryConfig.fromProperties(properties);
    }

    @Bean
    public ModuleSnapshotLoader moduleSnapshotLoader(@Qualifier("engineProperties") Properties properties) {
        return new ModuleSnapshotLoader(
                Integer.parseInt(required(properties, "data.moduleCount")),
                Double.parseDouble(properties.getProperty("data.stability.coreThreshold", "0.8")),
                Double.parseDouble(properties.getProperty("data.stability.unstableThreshold", "0.5")));
    }

    // The repository holds the snapshot loaded at startup; later snapshots are published on it
    @Bean
    public ReloadableModuleRepository moduleRepository(@Qualifier("engineProperties") Properties properties,
                                                       ModuleSnapshotLoader loader) {
        ModuleSnapshot initial = loader.load(required(properties, "data.snapshot"));
        return new ReloadableModuleRepository(initial);
    }

    @Bean
    public IModuleScoringService moduleScoringService(ReloadableModuleRepository moduleRepository,
                                                      ScoringConfig scoringConfig) {
        return new ModuleScoringService(moduleRepository, scoringConfig);
    }

    @Bean
    public IGeneRankingService geneRankingService(ReloadableModuleRepository moduleRepository,
                                                  ScoringConfig scoringConfig) {
        return new GeneRankingService(moduleRepository, scoringConfig);
    }

    @Bean
    public IPhenotypePredictionService phenotypePredictionService(ReloadableModuleRepository moduleRepository,
                                                                  PredictionConfig predictionConfig) {
        return new PhenotypePredictionService(moduleRepository, predictionConfig);
    }

    @Bean
    public IClinicalSupportService clinicalSupportService(ReloadableModuleRepository moduleRepository,
                                                          ScoringConfig scoringConfig,
                                                          PredictionConfig predictionConfig,
                                                          QueryConfig queryConfig) {
        return new ClinicalSupportService(moduleRepository, scoringConfig, predictionConfig, queryConfig);
    }

    @Bean
    public AllServices allServices(
            ReloadableModuleRepository moduleRepository,
            IModuleScoringService moduleScoringService,
            IGeneRankingService geneRankingService,
            IPhenotypePredictionService phenotypePredictionService,
            IClinicalSupportService clinicalSupportService,
            ScoringConfig scoringConfig,
            PredictionConfig predictionConfig) {
        return new AllServices(moduleRepository, moduleScoringService, geneRankingService,
                phenotypePredictionService, clinicalSupportService, scoringConfig, predictionConfig);
    }

    private static String required(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required property " + key + " in " + CONFIG_RESOURCE);
        }
        return value.trim();
    }
}
