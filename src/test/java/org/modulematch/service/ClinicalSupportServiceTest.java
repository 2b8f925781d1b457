package org.modulematch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.modulematch.TestModules;
import org.modulematch.domain.ExplainabilityItem;
import org.modulematch.domain.GeneCandidate;
import org.modulematch.domain.GeneQueryResult;
import org.modulematch.domain.ModuleSummary;
import org.modulematch.domain.PhenotypePrediction;
import org.modulematch.domain.QueryResult;
import org.modulematch.domain.StabilityClass;
import org.modulematch.domain.validation.ValidationException;
import org.modulematch.repository.EntityNotFoundException;
import org.modulematch.repository.RepositoryException;
import org.modulematch.repository.entitiesRepository.ModuleSnapshot;
import org.modulematch.repository.entitiesRepository.ReloadableModuleRepository;
import org.modulematch.repository.interfaces.IModuleRepository;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.modulematch.TestModules.HEARING;
import static org.modulematch.TestModules.NYSTAGMUS;
import static org.modulematch.TestModules.POLYDACTYLY;
import static org.modulematch.TestModules.ROD_CONE;

class ClinicalSupportServiceTest {

    private ReloadableModuleRepository repository;
    private ClinicalSupportService service;

    @BeforeEach
    void setUp() {
        repository = new ReloadableModuleRepository(TestModules.standard());
        service = new ClinicalSupportService(repository, ScoringConfig.defaults(), PredictionConfig.defaults(),
                QueryConfig.defaults());
    }

    @Test
    void alternativeGenesWithEqualSupportPreferTheMoreStableGene() throws ServicesException {
        ModuleSnapshot tables = ModuleSnapshot.builder(2)
                .addGene(TestModules.gene("TOP1", 0, 0.9, StabilityClass.CORE))
                .addGene(TestModules.gene("AAA", 1, 0.55, StabilityClass.PERIPHERAL))
                .addGene(TestModules.gene("ZZZ", 1, 0.75, StabilityClass.PERIPHERAL))
                .addPhenotype(0, TestModules.profile("HP:P1", "First", 80, 80, "TOP1"))
                .addPhenotype(1, TestModules.profile("HP:P2", "Second", 20, 20, "AAA", "ZZZ"))
                .build();
        ClinicalSupportService alternatives = new ClinicalSupportService(new ReloadableModuleRepository(tables),
                ScoringConfig.defaults(), PredictionConfig.defaults(), QueryConfig.defaults());

        QueryResult result = alternatives.query(List.of("HP:P1", "HP:P2"), List.of());

        assertThat(result.getBestModule().orElseThrow().getModuleId()).isZero();
        assertThat(result.getAlternativeGenes()).extracting(GeneCandidate::getGene).containsExactly("ZZZ", "AAA");
    }

    @Test
    void queryCombinesRankingGenesPredictionsAndQuestions() throws ServicesException {
        QueryResult result = service.query(List.of("Rod-cone dystrophy", "HP:0010442"), List.of());

        assertThat(result.getBestModule().orElseThrow().getModuleId()).isZero();
        assertThat(result.getConfidence()).isCloseTo(0.4 / 0.7, within(1e-9));
        assertThat(result.getObservedPhenotypes()).containsExactly(ROD_CONE, POLYDACTYLY);
        assertThat(result.getCandidateGenes()).extracting(GeneCandidate::getGene).containsExactly("RPGR", "RP2", "CRX");
        assertThat(result.getAlternativeGenes()).extracting(GeneCandidate::getGene).containsExactly("GLI3", "ZIC2");
        assertThat(result.getPredictedPhenotypes()).extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(NYSTAGMUS);
        assertThat(result.getDiscriminativeQuestions()).extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(NYSTAGMUS);
        assertThat(result.getExplanation()).extracting(ExplainabilityItem::getPhenotypeId).containsExactly(ROD_CONE);
        assertThat(result.getNextQuestion().getPhenotypeId()).contains(HEARING);
        assertThat(result.getUnmatchedInputs()).isEmpty();
    }

    @Test
    void candidateGeneCountFollowsQueryConfig() throws ServicesException {
        ClinicalSupportService narrow = new ClinicalSupportService(repository, ScoringConfig.defaults(),
                PredictionConfig.defaults(), new QueryConfig(1, 4, 1));

        QueryResult result = narrow.query(List.of("Rod-cone dystrophy", "Polydactyly"), List.of());

        assertThat(result.getCandidateGenes()).extracting(GeneCandidate::getGene).containsExactly("RPGR");
        assertThat(result.getAlternativeGenes()).extracting(GeneCandidate::getGene).containsExactly("GLI3");
    }

    @Test
    void explanationListsPenaltiesAfterLargerContributions() throws ServicesException {
        QueryResult result = service.query(List.of("Rod-cone dystrophy"), List.of("Nystagmus"));

        assertThat(result.getExcludedPhenotypes()).containsExactly(NYSTAGMUS);
        assertThat(result.getExplanation()).extracting(ExplainabilityItem::getPhenotypeId)
                .containsExactly(ROD_CONE, NYSTAGMUS);
        assertThat(result.getExplanation().get(1).getContribution()).isNegative();
    }

    @Test
    void unmatchedLabelsAreReportedNotFatal() throws ServicesException {
        QueryResult result = service.query(List.of("Rod-cone dystrophy", "Webbed toes"), null);

        assertThat(result.getUnmatchedInputs()).containsExactly("Webbed toes");
        assertThat(result.getBestModule().orElseThrow().getScore()).isCloseTo(0.7, within(1e-9));
        assertThat(result.summary()).contains("Best Module: 0").contains("Unmatched inputs: Webbed toes");
    }

    @Test
    void emptyQueryStillSuggestsAQuestion() throws ServicesException {
        QueryResult result = service.query(List.of(), List.of());

        assertThat(result.getConfidence()).isEqualTo(0.0);
        assertThat(result.getCandidateGenes()).isEmpty();
        assertThat(result.getPredictedPhenotypes()).isEmpty();
        assertThat(result.getExplanation()).isEmpty();
        assertThat(result.getNextQuestion().getPhenotypeId()).contains(ROD_CONE);
    }

    @Test
    void sameLabelObservedAndExcludedIsRejected() {
        assertThatThrownBy(() -> service.query(List.of("HP:0000510"), List.of("rod-cone dystrophy")))
                .isInstanceOf(ServicesException.class)
                .hasCauseInstanceOf(ValidationException.class);
    }

    @Test
    void blankLabelIsRejected() {
        assertThatThrownBy(() -> service.query(Arrays.asList("Nystagmus", " "), List.of()))
                .isInstanceOf(ServicesException.class)
                .hasMessageContaining("position 1");
    }

    @Test
    void providerFailureIsWrappedInServicesException() {
        IModuleRepository failing = mock(IModuleRepository.class);
        when(failing.snapshot()).thenThrow(new RepositoryException("provider unavailable"));
        ClinicalSupportService broken = new ClinicalSupportService(failing, ScoringConfig.defaults(),
                PredictionConfig.defaults(), QueryConfig.defaults());

        assertThatThrownBy(() -> broken.query(List.of("Nystagmus"), List.of()))
                .isInstanceOf(ServicesException.class)
                .hasRootCauseMessage("provider unavailable");
        verify(failing).snapshot();
    }

    @Test
    void queryJsonCarriesStabilityLabels() throws ServicesException {
        String json = service.query(List.of("Rod-cone dystrophy"), List.of()).toJson();

        assertThat(json).contains("\"matchedModules\"").contains("\"classification\": \"core\"");
    }

    @Test
    void queryRunsAgainstNewlyPublishedSnapshot() throws ServicesException {
        ModuleSnapshot replacement = ModuleSnapshot.builder(1)
                .addGene(TestModules.gene("USH2A", 0, 0.9, StabilityClass.CORE))
                .addPhenotype(0, TestModules.profile(ROD_CONE, "Rod-cone dystrophy", 100, 100, "USH2A"))
                .build();

        repository.publish(replacement);
        QueryResult result = service.query(List.of("Rod-cone dystrophy"), List.of());

        assertThat(result.getMatchedModules()).hasSize(1);
        assertThat(result.getBestModule().orElseThrow().getScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getCandidateGenes()).extracting(GeneCandidate::getGene).containsExactly("USH2A");
    }

    @Test
    void geneQueryDescribesItsModule() throws ServicesException {
        Optional<GeneQueryResult> result = service.queryGene("RPGR");

        assertThat(result).isPresent();
        GeneQueryResult gene = result.get();
        assertThat(gene.getModuleId()).isZero();
        assertThat(gene.getClassification()).isEqualTo(StabilityClass.CORE);
        assertThat(gene.getModuleGenes()).extracting(GeneCandidate::getGene).containsExactly("RP2", "CRX");
        assertThat(gene.getCharacteristicPhenotypes()).extracting(PhenotypePrediction::getPhenotypeId)
                .containsExactly(ROD_CONE, NYSTAGMUS, HEARING);
        assertThat(gene.summary()).contains("Gene: RPGR");
    }

    @Test
    void unknownGeneIsEmptyAndBlankGeneIsRejected() throws ServicesException {
        assertThat(service.queryGene("rpgr")).isEmpty();
        assertThatThrownBy(() -> service.queryGene("  ")).isInstanceOf(ServicesException.class);
    }

    @Test
    void suggestNextPhenotypeResolvesLabels() throws ServicesException {
        assertThat(service.suggestNextPhenotype(List.of("Rod-cone dystrophy", "Polydactyly"), List.of())
                .getPhenotypeId()).contains(HEARING);
    }

    @Test
    void moduleSummaryListsCoreGenes() throws ServicesException {
        ModuleSummary summary = service.moduleSummary(0);

        assertThat(summary.getTotalGenes()).isEqualTo(3);
        assertThat(summary.getCoreGenes()).containsExactly("RPGR");
        assertThat(summary.getTopPhenotypes()).hasSize(3);
    }

    @Test
    void moduleSummaryOfUnknownModuleFails() {
        assertThatThrownBy(() -> service.moduleSummary(5))
                .isInstanceOf(ServicesException.class)
                .hasCauseInstanceOf(EntityNotFoundException.class);
    }
}
