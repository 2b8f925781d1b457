package org.modulematch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.modulematch.domain.QueryResult;
import org.modulematch.repository.entitiesRepository.ReloadableModuleRepository;
import org.modulematch.service.AllServices;
import org.modulematch.service.QueryConfig;
import org.modulematch.service.ServicesException;
import org.modulematch.session.InteractiveSession;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModuleMatchConfigTest {

    private AnnotationConfigApplicationContext context;

    @BeforeEach
    void setUp() {
        context = new AnnotationConfigApplicationContext(ModuleMatchConfig.class);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void wiresSnapshotFromEngineConfig() {
        ReloadableModuleRepository repository = context.getBean(ReloadableModuleRepository.class);

        assertThat(repository.getAllModuleIds()).containsExactly(0, 1, 2);
        assertThat(repository.snapshot().getGeneCount()).isEqualTo(6);
        assertThat(context.getBean(QueryConfig.class).getTopGenes()).isEqualTo(2);
    }

    @Test
    void allServicesAnswerAQuery() throws ServicesException {
        AllServices services = context.getBean(AllServices.class);

        QueryResult result = services.getClinicalSupportService()
                .query(List.of("Rod-cone dystrophy", "Polydactyly"), List.of());

        assertThat(result.getBestModule().orElseThrow().getModuleId()).isZero();
        assertThat(result.getCandidateGenes()).hasSize(2);
    }

    @Test
    void eachSessionStartsEmpty() {
        AllServices services = context.getBean(AllServices.class);

        InteractiveSession first = services.newSession();
        first.answerYes("Nystagmus");
        InteractiveSession second = services.newSession();

        assertThat(first.observed()).hasSize(1);
        assertThat(second.observed()).isEmpty();
    }
}
