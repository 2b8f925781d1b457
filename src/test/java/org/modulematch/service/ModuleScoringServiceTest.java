package org.modulematch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.modulematch.TestModules;
import org.modulematch.domain.ExplainabilityItem;
import org.modulematch.domain.ModuleMatch;
import org.modulematch.domain.ModuleRanking;
import org.modulematch.domain.StabilityClass;
import org.modulematch.domain.validation.ValidationException;
import org.modulematch.repository.entitiesRepository.ModuleSnapshot;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.modulematch.TestModules.HEARING;
import static org.modulematch.TestModules.NYSTAGMUS;
import static org.modulematch.TestModules.POLYDACTYLY;
import static org.modulematch.TestModules.ROD_CONE;

class ModuleScoringServiceTest {
    private static final double EPS = 1e-9;

    private ModuleScoringService service;

    @BeforeEach
    void setUp() {
        service = new ModuleScoringService(TestModules.standard(), ScoringConfig.defaults());
    }

    @Test
    void observedPhenotypeContributesHalfItsCombinedWeight() {
        ModuleRanking ranking = service.rankModules(Set.of(ROD_CONE), Set.of());

        ModuleMatch best = ranking.getBest().orElseThrow();
        assertThat(best.getModuleId()).isZero();
        assertThat(best.getScore()).isCloseTo(0.70, within(EPS));
        assertThat(best.getContributingPhenotypes()).hasSize(1);
        ExplainabilityItem item = best.getContributingPhenotypes().get(0);
        assertThat(item.getPhenotypeId()).isEqualTo(ROD_CONE);
        assertThat(item.getPhenotypeName()).isEqualTo("Rod-cone dystrophy");
        assertThat(item.getContribution()).isCloseTo(0.70, within(EPS));
    }

    @Test
    void explanationTextDoesNotFollowTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            ModuleMatch best = service.rankModules(Set.of(ROD_CONE), Set.of(NYSTAGMUS)).getBest().orElseThrow();

            assertThat(best.getContributingPhenotypes().get(0).getExplanation())
                    .isEqualTo("Present in module (prevalence: 80.0%, specificity: 60.0%)");
            assertThat(best.getPenalizedPhenotypes().get(0).getExplanation())
                    .isEqualTo("Excluded but present in module (prevalence: 40.0%)");
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void excludedPhenotypePenalizesEveryModuleHoldingIt() {
        ModuleRanking ranking = service.rankModules(Set.of(ROD_CONE), Set.of(NYSTAGMUS));

        assertThat(ranking.getMatches()).extracting(ModuleMatch::getModuleId).containsExactly(0, 2, 1);
        assertThat(ranking.getMatches().get(0).getScore()).isCloseTo(0.6125, within(EPS));
        assertThat(ranking.getMatches().get(1).getScore()).isEqualTo(0.0);
        assertThat(ranking.getMatches().get(2).getScore()).isCloseTo(-0.1125, within(EPS));

        List<ExplainabilityItem> penalized = ranking.getMatches().get(0).getPenalizedPhenotypes();
        assertThat(penalized).hasSize(1);
        assertThat(penalized.get(0).getPhenotypeId()).isEqualTo(NYSTAGMUS);
        assertThat(penalized.get(0).getContribution()).isCloseTo(-0.0875, within(EPS));
    }

    @Test
    void confidenceIsRelativeGapBetweenTopTwo() {
        ModuleRanking ranking = service.rankModules(Set.of(ROD_CONE, POLYDACTYLY), Set.of());

        assertThat(ranking.getMatches().get(0).getScore()).isCloseTo(0.70, within(EPS));
        assertThat(ranking.getMatches().get(1).getScore()).isCloseTo(0.30, within(EPS));
        assertThat(ranking.getConfidence()).isCloseTo(0.4 / 0.7, within(EPS));
        assertThat(ranking.getMatches().get(0).getConfidence()).isCloseTo(0.4 / 0.7, within(EPS));
        // runner-up share of the remaining confidence
        assertThat(ranking.getMatches().get(1).getConfidence()).isCloseTo(9.0 / 49.0, within(EPS));
        assertThat(ranking.getMatches().get(2).getConfidence()).isEqualTo(0.0);
    }

    @Test
    void emptyQueryScoresZeroInModuleIdOrder() {
        ModuleRanking ranking = service.rankModules(Set.of(), Set.of());

        assertThat(ranking.getMatches()).extracting(ModuleMatch::getModuleId).containsExactly(0, 1, 2);
        assertThat(ranking.getMatches()).allSatisfy(m -> assertThat(m.getScore()).isEqualTo(0.0));
        assertThat(ranking.getConfidence()).isEqualTo(0.0);
    }

    @Test
    void excludedPhenotypeAbsentFromModuleLeavesItsScoreAlone() {
        ModuleRanking ranking = service.rankModules(Set.of(), Set.of(POLYDACTYLY));

        ModuleMatch module0 = ranking.getMatches().stream()
                .filter(m -> m.getModuleId() == 0)
                .findFirst().orElseThrow();
        assertThat(module0.getScore()).isEqualTo(0.0);
        assertThat(module0.getPenalizedPhenotypes()).isEmpty();
    }

    @Test
    void confidenceIsZeroWhenNoModuleScoresAboveZero() {
        ModuleRanking ranking = service.rankModules(Set.of(), Set.of(NYSTAGMUS));

        assertThat(ranking.getMatches()).extracting(ModuleMatch::getModuleId).containsExactly(2, 0, 1);
        assertThat(ranking.getConfidence()).isEqualTo(0.0);
    }

    @Test
    void confidenceExceedsOneWhenRunnerUpIsNegative() {
        ModuleSnapshot twoModules = ModuleSnapshot.builder(2)
                .addGene(TestModules.gene("G0", 0, 0.9, StabilityClass.CORE))
                .addGene(TestModules.gene("G1", 1, 0.9, StabilityClass.CORE))
                .addPhenotype(0, TestModules.profile("HP:1", "One", 80, 60, "G0"))
                .addPhenotype(1, TestModules.profile("HP:2", "Two", 40, 40, "G1"))
                .build();
        ModuleScoringService scoring = new ModuleScoringService(twoModules, ScoringConfig.defaults());

        ModuleRanking ranking = scoring.rankModules(Set.of("HP:1"), Set.of("HP:2"));

        assertThat(ranking.getMatches().get(1).getScore()).isCloseTo(-0.1, within(EPS));
        assertThat(ranking.getConfidence()).isCloseTo(0.8 / 0.7, within(EPS)).isGreaterThan(1.0);
    }

    @Test
    void equalScoresAreOrderedByModuleId() {
        // module 0 at 0.35, module 1 at 0.45, module 2 at 0
        ModuleRanking ranking = service.rankModules(Set.of(NYSTAGMUS), Set.of());

        assertThat(ranking.getMatches()).extracting(ModuleMatch::getModuleId).containsExactly(1, 0, 2);
    }

    @Test
    void rankingIsIdempotent() {
        Set<String> observed = Set.of(ROD_CONE, NYSTAGMUS, HEARING);
        Set<String> excluded = Set.of(POLYDACTYLY);

        ModuleRanking first = service.rankModules(observed, excluded);
        ModuleRanking second = service.rankModules(observed, excluded);

        assertThat(second.getMatches()).extracting(ModuleMatch::getModuleId)
                .isEqualTo(first.getMatches().stream().map(ModuleMatch::getModuleId).toList());
        assertThat(second.getMatches()).extracting(ModuleMatch::getScore)
                .isEqualTo(first.getMatches().stream().map(ModuleMatch::getScore).toList());
        assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
    }

    @Test
    void unmatchedLabelsAreReportedAndIgnored() {
        ModuleRanking ranking = service.rankModulesByLabels(
                List.of("rod-cone dystrophy", "Webbed toes"), List.of("Not a phenotype"));

        assertThat(ranking.getUnmatchedInputs()).containsExactly("Webbed toes", "Not a phenotype");
        assertThat(ranking.getBest().orElseThrow().getScore()).isCloseTo(0.70, within(EPS));
    }

    @Test
    void overlappingObservedAndExcludedIsRejected() {
        assertThatThrownBy(() -> service.rankModules(Set.of(ROD_CONE), Set.of(ROD_CONE)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(ROD_CONE);
    }

    @Test
    void scoreModuleLeavesConfidenceUnset() {
        ModuleMatch match = service.scoreModule(1, Set.of(POLYDACTYLY), Set.of());

        assertThat(match.getScore()).isCloseTo(0.30, within(EPS));
        assertThat(match.getConfidence()).isEqualTo(0.0);
        assertThat(match.getGeneCount()).isEqualTo(2);
    }

    @Test
    void exclusionPenaltyIsConfigurable() {
        ModuleScoringService harsh = new ModuleScoringService(TestModules.standard(),
                ScoringConfig.builder().exclusionPenalty(1.0).build());

        ModuleMatch match = harsh.scoreModule(0, Set.of(ROD_CONE), Set.of(NYSTAGMUS));

        assertThat(match.getScore()).isCloseTo(0.70 - 70.0 / 400, within(EPS));
    }
}
