package com.surveyscore.backend.survey.repo;

import com.surveyscore.backend.survey.engine.Classifier;
import com.surveyscore.backend.survey.engine.ScoredSubmission;
import com.surveyscore.backend.survey.engine.Scorer;
import com.surveyscore.backend.survey.engine.SubmissionValidator;
import com.surveyscore.backend.survey.engine.SurveyScoringEngine;
import com.surveyscore.backend.survey.entity.FatigueResultEntity;
import com.surveyscore.backend.survey.entity.InsomniaResultEntity;
import com.surveyscore.backend.survey.entity.IsmaResultEntity;
import com.surveyscore.backend.survey.instrument.InstrumentCatalog;
import com.surveyscore.backend.survey.instrument.InstrumentRegistry;
import com.surveyscore.backend.survey.mapper.SurveyResultMapper;
import com.surveyscore.backend.testsupport.SurveyFixtures;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class SurveyResultPersistenceTest {

    @Autowired IsmaResultRepository ismaRepo;
    @Autowired InsomniaResultRepository insomniaRepo;
    @Autowired FatigueResultRepository fatigueRepo;
    @Autowired EntityManager em;

    private final InstrumentRegistry registry = new InstrumentRegistry(InstrumentCatalog.defaults());
    private final SurveyScoringEngine engine =
            new SurveyScoringEngine(registry, new SubmissionValidator(true), new Scorer(), new Classifier());
    private final SurveyResultMapper mapper = new SurveyResultMapper();

    private ScoredSubmission scored(String instrument, int total) {
        return engine.evaluate(instrument, SurveyFixtures.withTotal(registry.get(instrument), total, 4));
    }

    @Test
    void stored_row_re_derives_total_from_columns() {
        ScoredSubmission s = scored("fatigue", 30);
        FatigueResultEntity saved = fatigueRepo.saveAndFlush((FatigueResultEntity) mapper.toEntity(3L, s));
        em.clear();

        FatigueResultEntity loaded = fatigueRepo.findById(saved.getResultId()).orElseThrow();

        assertThat(loaded.getTotalSum()).isEqualTo(30);
        assertThat(loaded.recomputeTotal()).isEqualTo(30);
        assertThat(loaded.responses()).containsExactlyEntriesOf(s.responses());
        assertThat(loaded.getBandCode()).isEqualTo("BAND_C");
        assertThat(loaded.getQuestionMn()).isEqualTo("Дунд зэргийн архаг ядаргаатай");
        assertThat(loaded.getCreatedAt()).isNotNull();
    }

    @Test
    void isma_row_keeps_user_id() {
        IsmaResultEntity saved = ismaRepo.saveAndFlush((IsmaResultEntity) mapper.toEntity(8L, scored("isma", 6)));
        em.clear();

        IsmaResultEntity loaded = ismaRepo.findById(saved.getResultId()).orElseThrow();
        assertThat(loaded.getUserId()).isEqualTo(8L);
        assertThat(loaded.getBandCode()).isEqualTo("HIGH_PROBABILITY");
        assertThat(ismaRepo.countByUserId(8L)).isEqualTo(1);
    }

    @Test
    void stored_result_is_not_changed_by_later_updates() {
        InsomniaResultEntity saved = insomniaRepo.saveAndFlush(
                (InsomniaResultEntity) mapper.toEntity(4L, scored("insomnia", 8)));
        Long id = saved.getResultId();
        em.clear();

        InsomniaResultEntity loaded = insomniaRepo.findById(id).orElseThrow();
        loaded.setTotalSum(99);
        loaded.setBandCode("SEVERE");
        loaded.setQuestionMn("changed");
        loaded.setUserId(5L);
        loaded.setFallAsleep(20);
        insomniaRepo.saveAndFlush(loaded);
        em.clear();

        InsomniaResultEntity reloaded = insomniaRepo.findById(id).orElseThrow();
        assertThat(reloaded.getTotalSum()).isEqualTo(8);
        assertThat(reloaded.getBandCode()).isEqualTo("MILD");
        assertThat(reloaded.getQuestionMn()).isEqualTo("Нойргүйдлийн зэрэг бага");
        assertThat(reloaded.getUserId()).isEqualTo(4L);
        assertThat(reloaded.getFallAsleep()).isEqualTo(4);
        assertThat(reloaded.recomputeTotal()).isEqualTo(8);
    }

    @Test
    void history_is_newest_first_and_scoped_to_user() {
        InsomniaResultEntity a = (InsomniaResultEntity) mapper.toEntity(1L, scored("insomnia", 3));
        a.setCreatedAt(Instant.parse("2026-03-01T08:00:00Z"));
        InsomniaResultEntity b = (InsomniaResultEntity) mapper.toEntity(1L, scored("insomnia", 20));
        b.setCreatedAt(Instant.parse("2026-03-02T08:00:00Z"));
        InsomniaResultEntity other = (InsomniaResultEntity) mapper.toEntity(2L, scored("insomnia", 9));

        insomniaRepo.saveAll(List.of(a, b, other));
        insomniaRepo.flush();

        List<InsomniaResultEntity> rows = insomniaRepo.findByUserIdOrderByCreatedAtDescIdDesc(1L);

        assertThat(rows).extracting(InsomniaResultEntity::getTotalSum).containsExactly(20, 3);
        assertThat(insomniaRepo.countByUserId(2L)).isEqualTo(1);
    }
}
