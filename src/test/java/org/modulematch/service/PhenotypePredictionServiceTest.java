package org.modulematch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.modulematch.TestModules;
import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.NextQuestion;
import org.modulematch.domain.PhenotypePrediction;
import org.modulematch.domain.validation.ValidationException;
import org.modulematch.repository.entitiesRepository.ModuleSnapshot;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.modulematch.TestModules.HEARING;
import static org.modulematch.TestModules.INTELLECTUAL;
import static org.modulematch.TestModules.NYSTAGMUS;
import static org.modulematch.TestModules.OBESITY;
import static org.modulematch.TestModules.POLYDACTYLY;
import static org.modulematch.TestModules.ROD_CONE;

class PhenotypePredictionServiceTest {

    private ModuleSnapshot snapshot;
    private ModuleScoringService scoring;
    private PhenotypePredictionService service;

    @BeforeEach
    void setUp() {
        snapshot = TestModules.standard();
        scoring = new ModuleScoringService(snapshot, ScoringConfig.defaults());
        service = new PhenotypePredictionService(snapshot, PredictionConfig.defaults());
    }

    @Test
    void predictionsSkipPhenotypesBelowMinimumPrevalence() {
        List<PhenotypePrediction> predictions = service.predictMissingPhenotypes(0, Set.of(), Set.of());

        assertThat(predictions).extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(ROD_CONE, NYSTAGMUS)
                .doesNotContain(HEARING);
        assertThat(predictions.get(0).getReason()).isEqualTo("Very common in module (80% of genes)");
        assertThat(predictions.get(1).getReason()).isEqualTo("Characteristic (prevalence: 40%, specificity: 30%)");
    }

    @Test
    void predictionsNeverRepeatAnsweredPhenotypes() {
        assertThat(service.predictMissingPhenotypes(0, Set.of(ROD_CONE), Set.of()))
                .extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(NYSTAGMUS);
        assertThat(service.predictMissingPhenotypes(0, Set.of(ROD_CONE), Set.of(NYSTAGMUS))).isEmpty();
    }

    @Test
    void equalPrevalenceFallsBackToSpecificityAndThresholdIsInclusive() {
        List<PhenotypePrediction> predictions = service.predictMissingPhenotypes(2, Set.of(), Set.of());

        assertThat(predictions).extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(INTELLECTUAL, OBESITY);
        assertThat(predictions.get(0).getReason())
                .isEqualTo("Highly specific to module (60% of genes with phenotype are in module)");
    }

    @Test
    void predictionCountIsLimited() {
        assertThat(service.predictMissingPhenotypes(0, Set.of(), Set.of(), 1))
                .extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(ROD_CONE);

        PhenotypePredictionService single = new PhenotypePredictionService(snapshot,
                PredictionConfig.builder().maxPredictions(1).build());
        assertThat(single.predictMissingPhenotypes(2, Set.of(), Set.of())).hasSize(1);

        assertThatThrownBy(() -> service.predictMissingPhenotypes(0, Set.of(), Set.of(), -1))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void expectedPhenotypesRankByPrevalenceTimesSpecificity() {
        assertThat(service.expectedPhenotypes(0, 2))
                .extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(ROD_CONE, NYSTAGMUS);
    }

    @Test
    void nextQuestionMaximisesGapBetweenTopTwoModules() {
        Set<String> observed = Set.of(ROD_CONE, POLYDACTYLY);
        List<ModuleMatch> ranked = scoring.rankModules(observed, Set.of()).getMatches();

        NextQuestion question = service.suggestNextQuestion(ranked, observed, Set.of());

        // hearing impairment widens the gap to 1.0 - 0.3, nystagmus only to 1.05 - 0.75
        assertThat(question.isAvailable()).isTrue();
        assertThat(question.isDiscriminative()).isTrue();
        assertThat(question.getPhenotypeId()).contains(HEARING);
        assertThat(question.getHypotheticalGap()).isCloseTo(0.7, within(1e-9));
        assertThat(question.getPhenotype().orElseThrow().getReason()).isEqualTo("10% of Module 0 VS 0% in Module 1");
    }

    @Test
    void nextQuestionSkipsPhenotypesAlreadyAsked() {
        Set<String> observed = Set.of(ROD_CONE, POLYDACTYLY);
        List<ModuleMatch> ranked = scoring.rankModules(observed, Set.of()).getMatches();

        NextQuestion question = service.suggestNextQuestion(ranked, observed, Set.of(HEARING));

        assertThat(question.getPhenotypeId()).contains(NYSTAGMUS);
        assertThat(question.getHypotheticalGap()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void nextQuestionFallsBackWhenTopModulesShareNothingOpen() {
        Set<String> observed = Set.of(INTELLECTUAL);
        List<ModuleMatch> ranked = scoring.rankModules(observed, Set.of()).getMatches();

        NextQuestion question = service.suggestNextQuestion(ranked, observed, Set.of());

        assertThat(question.isAvailable()).isTrue();
        assertThat(question.isDiscriminative()).isFalse();
        assertThat(question.getPhenotypeId()).contains(OBESITY);
        assertThat(question.getHypotheticalGap()).isEqualTo(0.0);
    }

    @Test
    void fallbackMovesDownTheRankingWhenTopModuleIsExhausted() {
        Set<String> observed = Set.of(INTELLECTUAL, OBESITY);
        List<ModuleMatch> ranked = scoring.rankModules(observed, Set.of()).getMatches();

        NextQuestion question = service.suggestNextQuestion(ranked, observed, Set.of());

        assertThat(ranked.get(0).getModuleId()).isEqualTo(2);
        assertThat(question.getPhenotypeId()).contains(ROD_CONE);
    }

    @Test
    void noQuestionWhenEverythingWasAsked() {
        Set<String> observed = Set.of(ROD_CONE, NYSTAGMUS, HEARING, POLYDACTYLY);
        Set<String> excluded = Set.of(OBESITY, INTELLECTUAL);
        List<ModuleMatch> ranked = scoring.rankModules(observed, excluded).getMatches();

        NextQuestion question = service.suggestNextQuestion(ranked, observed, excluded);

        assertThat(question.isAvailable()).isFalse();
        assertThat(question.getPhenotype()).isEmpty();
        assertThat(question).hasToString("no further question available");
        assertThat(service.suggestNextQuestion(List.of(), Set.of(), Set.of())).isSameAs(NextQuestion.none());
    }

    @Test
    void equalGapGoesToHigherWeightInTopModule() {
        // X only in the top module, Y in both: each widens the gap by 10 weight points
        ModuleSnapshot tables = ModuleSnapshot.builder(2)
                .addPhenotype(0, TestModules.profile("HP:A", "A", 10, 7))
                .addPhenotype(0, TestModules.profile("HP:X", "X", 5, 5))
                .addPhenotype(0, TestModules.profile("HP:Y", "Y", 10, 10))
                .addPhenotype(1, TestModules.profile("HP:B", "B", 5, 5))
                .addPhenotype(1, TestModules.profile("HP:Y", "Y", 5, 5))
                .build();
        Set<String> observed = Set.of("HP:A", "HP:B");
        List<ModuleMatch> ranked = new ModuleScoringService(tables, ScoringConfig.defaults())
                .rankModules(observed, Set.of()).getMatches();

        NextQuestion question = new PhenotypePredictionService(tables, PredictionConfig.defaults())
                .suggestNextQuestion(ranked, observed, Set.of());

        assertThat(ranked.get(0).getModuleId()).isEqualTo(0);
        assertThat(question.getPhenotypeId()).contains("HP:Y");
        assertThat(question.getHypotheticalGap()).isCloseTo(0.085, within(1e-9));
    }

    @Test
    void fullTieGoesToLowestPhenotypeId() {
        ModuleSnapshot tables = ModuleSnapshot.builder(2)
                .addPhenotype(0, TestModules.profile("HP:A", "A", 30, 30))
                .addPhenotype(0, TestModules.profile("HP:Q", "Q", 20, 20))
                .addPhenotype(0, TestModules.profile("HP:P", "P", 20, 20))
                .addPhenotype(0, TestModules.profile("HP:S", "S", 10, 10))
                .addPhenotype(1, TestModules.profile("HP:B", "B", 10, 10))
                .addPhenotype(1, TestModules.profile("HP:S", "S", 10, 10))
                .build();
        Set<String> observed = Set.of("HP:A", "HP:B");
        List<ModuleMatch> ranked = new ModuleScoringService(tables, ScoringConfig.defaults())
                .rankModules(observed, Set.of()).getMatches();

        NextQuestion question = new PhenotypePredictionService(tables, PredictionConfig.defaults())
                .suggestNextQuestion(ranked, observed, Set.of());

        assertThat(question.getPhenotypeId()).contains("HP:P");
        assertThat(question.getHypotheticalGap()).isCloseTo(0.2 + 0.2, within(1e-9));
    }

    @Test
    void discriminativeQuestionsCompareTopModuleWithRunnerUp() {
        Set<String> observed = Set.of(ROD_CONE, POLYDACTYLY);
        List<ModuleMatch> ranked = scoring.rankModules(observed, Set.of()).getMatches();

        List<PhenotypePrediction> questions = service.discriminativeQuestions(ranked, observed, Set.of(), 20);

        // hearing impairment averages 5% across the two modules and is dropped
        assertThat(questions).extracting(PhenotypePrediction::getPhenotypeId).containsExactly(NYSTAGMUS);
        assertThat(questions.get(0).getReason()).isEqualTo("40% of Module 0 VS 50% in Module 1");
    }

    @Test
    void noDiscriminativeQuestionsWhenRunnerUpDoesNotScore() {
        Set<String> observed = Set.of(ROD_CONE);
        List<ModuleMatch> ranked = scoring.rankModules(observed, Set.of()).getMatches();

        assertThat(service.discriminativeQuestions(ranked, observed, Set.of(), 20)).isEmpty();
    }
}
