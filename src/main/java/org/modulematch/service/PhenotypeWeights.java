package org.modulematch.service;

import org.modulematch.domain.PhenotypeProfile;

/**
 * Per-phenotype weights shared by module scoring, gene ranking and question selection.
 */
public final class PhenotypeWeights {

    private PhenotypeWeights() {
    }

    /** (prevalence + specificity) / 200, in [0,1]. */
    public static double contribution(PhenotypeProfile profile) {
        return contribution(profile.getCombinedWeight());
    }

    public static double contribution(double combinedWeight) {
        return combinedWeight / 200.0;
    }

    /** exclusionPenalty × (prevalence + specificity) / 400. */
    public static double penalty(PhenotypeProfile profile, double exclusionPenalty) {
        return exclusionPenalty * profile.getCombinedWeight() / 400.0;
    }
}
