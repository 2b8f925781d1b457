package org.modulematch.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.modulematch.domain.ExplainabilityItem;
import org.modulematch.domain.GeneCandidate;
import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.ModuleRanking;
import org.modulematch.domain.NextQuestion;
import org.modulematch.domain.PhenotypePrediction;
import org.modulematch.domain.QueryResult;
import org.modulematch.repository.interfaces.IModuleRepository;
import org.modulematch.service.ModuleScoringService;
import org.modulematch.service.SnapshotServices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Yes/no/unknown question loop over the scoring services. The session owns the only
 * mutable state in the system; every read re-derives the observed and excluded sets
 * from the recorded answers and re-runs the stateless services. Each read binds the
 * services to one snapshot of the tables and ranks the modules once.
 * <p>
 * Not thread-safe: one session serves one caller.
 */
public class InteractiveSession {
    private static final Logger log = LogManager.getLogger(InteractiveSession.class);

    private final IModuleRepository repository;
    private final Function<IModuleRepository, SnapshotServices> binder;

    private final Map<String, Answer> answers = new LinkedHashMap<>();
    private final List<AnsweredQuestion> history = new ArrayList<>();
    private final List<String> unmatchedInputs = new ArrayList<>();

    /**
     * @param repository the tables answers are resolved against
     * @param binder builds the services over a pinned snapshot
     */
    public InteractiveSession(IModuleRepository repository, Function<IModuleRepository, SnapshotServices> binder) {
        this.repository = repository;
        this.binder = binder;
    }

    /**
     * Records an answer. A later answer for the same phenotype replaces the earlier one.
     *
     * @param label phenotype name or id
     * @param answer the answer
     * @return false if the label matches no phenotype; the state is then unchanged
     */
    public boolean answer(String label, Answer answer) {
        Optional<String> phenotypeId = repository.resolvePhenotype(label);
        if (phenotypeId.isEmpty()) {
            log.warn("Ignoring answer {} for unmatched phenotype '{}'", answer, label);
            unmatchedInputs.add(label);
            return false;
        }
        Answer previous = answers.remove(phenotypeId.get());
        answers.put(phenotypeId.get(), answer);
        history.add(new AnsweredQuestion(label, phenotypeId.get(), answer));
        if (previous != null && previous != answer) {
            log.debug("Answer for {} changed from {} to {}", phenotypeId.get(), previous, answer);
        }
        return true;
    }

    public boolean answerYes(String label) {
        return answer(label, Answer.YES);
    }

    public boolean answerNo(String label) {
        return answer(label, Answer.NO);
    }

    public boolean answerUnknown(String label) {
        return answer(label, Answer.UNKNOWN);
    }

    public void reset() {
        answers.clear();
        history.clear();
        unmatchedInputs.clear();
    }

    public Set<String> observed() {
        return idsWith(Answer.YES);
    }

    public Set<String> excluded() {
        return idsWith(Answer.NO);
    }

    public Set<String> unknown() {
        return idsWith(Answer.UNKNOWN);
    }

    public Optional<Answer> answerFor(String phenotypeId) {
        return Optional.ofNullable(answers.get(phenotypeId));
    }

    public List<AnsweredQuestion> history() {
        return Collections.unmodifiableList(history);
    }

    public List<String> unmatchedInputs() {
        return Collections.unmodifiableList(unmatchedInputs);
    }

    public ModuleRanking ranking() {
        return ranking(pin());
    }

    public List<ModuleMatch> rankedModules() {
        return ranking().getMatches();
    }

    public Optional<ModuleMatch> bestModule() {
        return ranking().getBest();
    }

    public List<GeneCandidate> candidateGenes(int topN) {
        SnapshotServices pinned = pin();
        return candidateGenes(pinned, ranking(pinned), topN);
    }

    public List<PhenotypePrediction> predictedPhenotypes(int topN) {
        SnapshotServices pinned = pin();
        Optional<ModuleMatch> best = scoredBest(ranking(pinned));
        if (best.isEmpty()) {
            return List.of();
        }
        return pinned.getPrediction().predictMissingPhenotypes(best.get().getModuleId(), observed(), excluded(), topN);
    }

    /**
     * Unknown answers count as already asked, but they do not take part in scoring.
     */
    public NextQuestion nextQuestion() {
        SnapshotServices pinned = pin();
        return nextQuestion(pinned, ranking(pinned));
    }

    public QueryResult currentResult(int topGenes) {
        SnapshotServices pinned = pin();
        ModuleRanking ranking = ranking(pinned);
        QueryResult.Builder result = QueryResult.builder()
                .ranking(ranking)
                .observedPhenotypes(new ArrayList<>(observed()))
                .excludedPhenotypes(new ArrayList<>(excluded()))
                .unmatchedInputs(unmatchedInputs)
                .nextQuestion(nextQuestion(pinned, ranking));

        Optional<ModuleMatch> best = scoredBest(ranking);
        if (best.isPresent()) {
            List<ExplainabilityItem> explanation = new ArrayList<>(best.get().getContributingPhenotypes());
            explanation.addAll(best.get().getPenalizedPhenotypes());
            explanation.sort(ModuleScoringService.EXPLANATION_ORDER);

            result.candidateGenes(candidateGenes(pinned, ranking, topGenes))
                    .predictedPhenotypes(pinned.getPrediction().predictMissingPhenotypes(best.get().getModuleId(),
                            observed(), excluded()))
                    .explanation(explanation);
        }
        return result.build();
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Questions answered: ").append(history.size()).append(System.lineSeparator());
        sb.append("  Observed (YES): ").append(observed().size()).append(System.lineSeparator());
        sb.append("  Excluded (NO): ").append(excluded().size()).append(System.lineSeparator());
        sb.append("  Unknown: ").append(unknown().size()).append(System.lineSeparator());
        bestModule().ifPresent(best -> {
            sb.append(System.lineSeparator()).append("Current best match: Module ").append(best.getModuleId())
                    .append(System.lineSeparator());
            sb.append(String.format(Locale.ROOT, "  Score: %.3f%n", best.getScore()));
            sb.append(String.format(Locale.ROOT, "  Confidence: %.1f%%%n", best.getConfidence() * 100));
        });
        return sb.toString().trim();
    }

    private SnapshotServices pin() {
        return binder.apply(repository.snapshot());
    }

    private ModuleRanking ranking(SnapshotServices pinned) {
        return pinned.getScoring().rankModules(observed(), excluded());
    }

    private NextQuestion nextQuestion(SnapshotServices pinned, ModuleRanking ranking) {
        Set<String> notToAsk = excluded();
        notToAsk.addAll(unknown());
        return pinned.getPrediction().suggestNextQuestion(ranking.getMatches(), observed(), notToAsk);
    }

    private List<GeneCandidate> candidateGenes(SnapshotServices pinned, ModuleRanking ranking, int topN) {
        Optional<ModuleMatch> best = scoredBest(ranking);
        if (best.isEmpty()) {
            return List.of();
        }
        return pinned.getGenes().rankGenes(best.get().getModuleId(), observed()).stream()
                .limit(topN)
                .collect(Collectors.toList());
    }

    private static Optional<ModuleMatch> scoredBest(ModuleRanking ranking) {
        return ranking.getBest().filter(m -> m.getScore() > 0);
    }

    private Set<String> idsWith(Answer answer) {
        return answers.entrySet().stream()
                .filter(e -> e.getValue() == answer)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
