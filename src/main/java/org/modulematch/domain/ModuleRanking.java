package org.modulematch.domain;

import java.util.List;
import java.util.Optional;

/**
 * Every module ranked for one query, plus the inputs that could not be resolved.
 */
public class ModuleRanking {
    private final List<ModuleMatch> matches;
    private final double confidence;
    private final List<String> unmatchedInputs;

    public ModuleRanking(List<ModuleMatch> matches, double confidence, List<String> unmatchedInputs) {
        this.matches = List.copyOf(matches);
        this.confidence = confidence;
        this.unmatchedInputs = List.copyOf(unmatchedInputs);
    }

    public List<ModuleMatch> getMatches() {
        return matches;
    }

    public Optional<ModuleMatch> getBest() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getUnmatchedInputs() {
        return unmatchedInputs;
    }
}
