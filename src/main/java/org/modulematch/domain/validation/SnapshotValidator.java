package org.modulematch.domain.validation;

import org.modulematch.domain.Gene;
import org.modulematch.domain.PhenotypeProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Data-integrity checks applied before a snapshot becomes visible to queries.
 */
public final class SnapshotValidator {

    private SnapshotValidator() {
    }

    public static void validatePhenotype(int moduleId, PhenotypeProfile profile) {
        List<String> errors = new ArrayList<>();
        if (profile.getPhenotypeId() == null || profile.getPhenotypeId().isBlank()) {
            errors.add("phenotype id is blank");
        }
        if (!inPercentRange(profile.getPrevalence())) {
            errors.add("prevalence out of [0,100]: " + profile.getPrevalence());
        }
        if (!inPercentRange(profile.getSpecificity())) {
            errors.add("specificity out of [0,100]: " + profile.getSpecificity());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Module " + moduleId + ", phenotype " + profile.getPhenotypeId()
                    + ": " + String.join("; ", errors));
        }
    }

    public static void validateGene(Gene gene, int moduleCount) {
        if (gene.getModuleId() < 0 || gene.getModuleId() >= moduleCount) {
            throw new ValidationException("Gene " + gene.getSymbol() + " assigned to unknown module " + gene.getModuleId());
        }
        if (gene.getStabilityScore() < 0.0 || gene.getStabilityScore() > 1.0) {
            throw new ValidationException("Gene " + gene.getSymbol() + " has stability out of [0,1]: " + gene.getStabilityScore());
        }
    }

    /**
     * Genes annotated with the phenotype that are not assigned to the module.
     */
    public static Set<String> strayAnnotatedGenes(PhenotypeProfile profile, Set<String> moduleGenes) {
        Set<String> stray = new TreeSet<>(profile.getGenesWith());
        stray.removeAll(moduleGenes);
        return stray;
    }

    private static boolean inPercentRange(double value) {
        return value >= 0.0 && value <= 100.0;
    }
}
