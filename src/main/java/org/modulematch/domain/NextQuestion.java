package org.modulematch.domain;

import java.util.Optional;

/**
 * Outcome of next-question selection: either one phenotype to ask about, or none available.
 */
public class NextQuestion {
    private static final NextQuestion NONE = new NextQuestion(null, 0.0, false);

    private final PhenotypePrediction phenotype;
    private final double hypotheticalGap;
    private final boolean discriminative;

    private NextQuestion(PhenotypePrediction phenotype, double hypotheticalGap, boolean discriminative) {
        this.phenotype = phenotype;
        this.hypotheticalGap = hypotheticalGap;
        this.discriminative = discriminative;
    }

    /** Chosen by maximising the score gap between the top two modules. */
    public static NextQuestion discriminating(PhenotypePrediction phenotype, double hypotheticalGap) {
        return new NextQuestion(phenotype, hypotheticalGap, true);
    }

    /** Chosen as the most prevalent unasked phenotype of a single module. */
    public static NextQuestion fallback(PhenotypePrediction phenotype) {
        return new NextQuestion(phenotype, 0.0, false);
    }

    public static NextQuestion none() {
        return NONE;
    }

    public boolean isAvailable() {
        return phenotype != null;
    }

    public Optional<PhenotypePrediction> getPhenotype() {
        return Optional.ofNullable(phenotype);
    }

    public Optional<String> getPhenotypeId() {
        return getPhenotype().map(PhenotypePrediction::getPhenotypeId);
    }

    /** Top-minus-runner-up score if the phenotype were observed; 0 for fallback picks. */
    public double getHypotheticalGap() {
        return hypotheticalGap;
    }

    public boolean isDiscriminative() {
        return discriminative;
    }

    @Override
    public String toString() {
        if (phenotype == null) {
            return "no further question available";
        }
        return phenotype.getName() + " (" + phenotype.getPhenotypeId() + ")";
    }
}
