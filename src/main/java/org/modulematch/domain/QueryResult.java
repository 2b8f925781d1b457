package org.modulematch.domain;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Complete answer to one phenotype query.
 */
public class QueryResult {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    private final List<ModuleMatch> matchedModules;
    private final double confidence;
    private final List<GeneCandidate> candidateGenes;
    private final List<GeneCandidate> alternativeGenes;
    private final List<PhenotypePrediction> predictedPhenotypes;
    private final List<PhenotypePrediction> discriminativeQuestions;
    private final NextQuestion nextQuestion;
    private final List<ExplainabilityItem> explanation;
    private final List<String> observedPhenotypes;
    private final List<String> excludedPhenotypes;
    private final List<String> unmatchedInputs;

    private QueryResult(Builder builder) {
        this.matchedModules = List.copyOf(builder.matchedModules);
        this.confidence = builder.confidence;
        this.candidateGenes = List.copyOf(builder.candidateGenes);
        this.alternativeGenes = List.copyOf(builder.alternativeGenes);
        this.predictedPhenotypes = List.copyOf(builder.predictedPhenotypes);
        this.discriminativeQuestions = List.copyOf(builder.discriminativeQuestions);
        this.nextQuestion = builder.nextQuestion;
        this.explanation = List.copyOf(builder.explanation);
        this.observedPhenotypes = List.copyOf(builder.observedPhenotypes);
        this.excludedPhenotypes = List.copyOf(builder.excludedPhenotypes);
        this.unmatchedInputs = List.copyOf(builder.unmatchedInputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ModuleMatch> getMatchedModules() {
        return matchedModules;
    }

    public Optional<ModuleMatch> getBestModule() {
        return matchedModules.isEmpty() ? Optional.empty() : Optional.of(matchedModules.get(0));
    }

    public double getConfidence() {
        return confidence;
    }

    public List<GeneCandidate> getCandidateGenes() {
        return candidateGenes;
    }

    /** Best-supported genes from the runner-up modules. */
    public List<GeneCandidate> getAlternativeGenes() {
        return alternativeGenes;
    }

    public List<PhenotypePrediction> getPredictedPhenotypes() {
        return predictedPhenotypes;
    }

    public List<PhenotypePrediction> getDiscriminativeQuestions() {
        return discriminativeQuestions;
    }

    public NextQuestion getNextQuestion() {
        return nextQuestion;
    }

    public List<ExplainabilityItem> getExplanation() {
        return explanation;
    }

    public List<String> getObservedPhenotypes() {
        return observedPhenotypes;
    }

    public List<String> getExcludedPhenotypes() {
        return excludedPhenotypes;
    }

    public List<String> getUnmatchedInputs() {
        return unmatchedInputs;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        getBestModule().ifPresent(best -> {
            sb.append(String.format(Locale.ROOT, "Best Module: %d (score: %.3f, confidence: %.2f%%)%n",
                    best.getModuleId(), best.getScore(), best.getConfidence() * 100));
            sb.append(String.format(Locale.ROOT, "  Genes in module: %d%n", best.getGeneCount()));
        });

        if (!candidateGenes.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "%nTop Candidate Genes (%d total):%n", candidateGenes.size()));
            candidateGenes.stream().limit(5)
                    .forEach(g -> sb.append("  - ").append(g).append(System.lineSeparator()));
        }

        if (!predictedPhenotypes.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "%nPredicted Missing Phenotypes:%n"));
            predictedPhenotypes.stream().limit(5)
                    .forEach(p -> sb.append(String.format(Locale.ROOT, "  - %s (prevalence: %.1f%%)%n",
                            p.getName(), p.getPrevalence())));
        }

        if (nextQuestion != null && nextQuestion.isAvailable()) {
            sb.append(String.format(Locale.ROOT, "%nSuggested next question: %s%n", nextQuestion));
        }

        if (!unmatchedInputs.isEmpty()) {
            sb.append(String.format(Locale.ROOT, "%nUnmatched inputs: %s%n", String.join(", ", unmatchedInputs)));
        }
        return sb.toString().trim();
    }

    public static class Builder {
        private List<ModuleMatch> matchedModules = List.of();
        private double confidence;
        private List<GeneCandidate> candidateGenes = List.of();
        private List<GeneCandidate> alternativeGenes = List.of();
        private List<PhenotypePrediction> predictedPhenotypes = List.of();
        private List<PhenotypePrediction> discriminativeQuestions = List.of();
        private NextQuestion nextQuestion = NextQuestion.none();
        private List<ExplainabilityItem> explanation = List.of();
        private List<String> observedPhenotypes = List.of();
        private List<String> excludedPhenotypes = List.of();
        private List<String> unmatchedInputs = List.of();

        private Builder() {
        }

        public Builder ranking(ModuleRanking ranking) {
            this.matchedModules = ranking.getMatches();
            this.confidence = ranking.getConfidence();
            return this;
        }

        public Builder candidateGenes(List<GeneCandidate> candidateGenes) {
            this.candidateGenes = candidateGenes;
            return this;
        }

        public Builder alternativeGenes(List<GeneCandidate> alternativeGenes) {
            this.alternativeGenes = alternativeGenes;
            return this;
        }

        public Builder predictedPhenotypes(List<PhenotypePrediction> predictedPhenotypes) {
            this.predictedPhenotypes = predictedPhenotypes;
            return this;
        }

        public Builder discriminativeQuestions(List<PhenotypePrediction> discriminativeQuestions) {
            this.discriminativeQuestions = discriminativeQuestions;
            return this;
        }

        public Builder nextQuestion(NextQuestion nextQuestion) {
            this.nextQuestion = nextQuestion;
            return this;
        }

        public Builder explanation(List<ExplainabilityItem> explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder observedPhenotypes(List<String> observedPhenotypes) {
            this.observedPhenotypes = observedPhenotypes;
            return this;
        }

        public Builder excludedPhenotypes(List<String> excludedPhenotypes) {
            this.excludedPhenotypes = excludedPhenotypes;
            return this;
        }

        public Builder unmatchedInputs(List<String> unmatchedInputs) {
            this.unmatchedInputs = unmatchedInputs;
            return this;
        }

        public QueryResult build() {
            return new QueryResult(this);
        }
    }
}
