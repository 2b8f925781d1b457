package org.modulematch.service;

import java.util.Properties;

/**
 * Result sizes for the combined phenotype query.
 */
public final class QueryConfig {
    public static final int DEFAULT_TOP_GENES = 20;
    public static final int DEFAULT_ALTERNATIVE_MODULES = 4;
    public static final int DEFAULT_ALTERNATIVE_GENES = 3;

    private final int topGenes;
    private final int alternativeModules;
    private final int alternativeGenes;

    public QueryConfig(int topGenes, int alternativeModules, int alternativeGenes) {
        if (topGenes < 0 || alternativeModules < 0 || alternativeGenes < 0) {
            throw new IllegalArgumentException("Query sizes must not be negative");
        }
        this.topGenes = topGenes;
        this.alternativeModules = alternativeModules;
        this.alternativeGenes = alternativeGenes;
    }

    public static QueryConfig defaults() {
        return new QueryConfig(DEFAULT_TOP_GENES, DEFAULT_ALTERNATIVE_MODULES, DEFAULT_ALTERNATIVE_GENES);
    }

    public static QueryConfig fromProperties(Properties properties) {
        return new QueryConfig(
                ConfigProperties.getInt(properties, "query.topGenes", DEFAULT_TOP_GENES),
                ConfigProperties.getInt(properties, "query.alternativeModules", DEFAULT_ALTERNATIVE_MODULES),
                ConfigProperties.getInt(properties, "query.alternativeGenes", DEFAULT_ALTERNATIVE_GENES));
    }

    public int getTopGenes() {
        return topGenes;
    }

    /** How many runner-up modules are searched for alternative genes. */
    public int getAlternativeModules() {
        return alternativeModules;
    }

    public int getAlternativeGenes() {
        return alternativeGenes;
    }
}
