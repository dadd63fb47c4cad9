package com.surveyscore.backend.survey.mapper;

import com.surveyscore.backend.survey.engine.Classifier;
import com.surveyscore.backend.survey.engine.ScoredSubmission;
import com.surveyscore.backend.survey.engine.Scorer;
import com.surveyscore.backend.survey.engine.SubmissionValidator;
import com.surveyscore.backend.survey.engine.SurveyScoringEngine;
import com.surveyscore.backend.survey.entity.FatigueResultEntity;
import com.surveyscore.backend.survey.entity.InsomniaResultEntity;
import com.surveyscore.backend.survey.entity.IsmaResultEntity;
import com.surveyscore.backend.survey.entity.SurveyResultEntity;
import com.surveyscore.backend.survey.instrument.Instrument;
import com.surveyscore.backend.survey.instrument.InstrumentCatalog;
import com.surveyscore.backend.survey.instrument.InstrumentRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SurveyResultMapperTest {

    private final InstrumentRegistry registry = new InstrumentRegistry(InstrumentCatalog.defaults());
    private final SurveyScoringEngine engine =
            new SurveyScoringEngine(registry, new SubmissionValidator(true), new Scorer(), new Classifier());
    private final SurveyResultMapper mapper = new SurveyResultMapper();

    /** 每題給不同分數，才抓得到欄位接錯 */
    private static Map<String, Integer> distinct(Instrument ins) {
        Map<String, Integer> m = new LinkedHashMap<>();
        int i = 0;
        for (String k : ins.externalKeys()) m.put(k, i++ % 5);
        return m;
    }

    @Test
    void every_instrument_maps_each_question_to_its_own_column() {
        for (Instrument ins : registry.all()) {
            ScoredSubmission scored = engine.evaluate(ins.name(), distinct(ins));

            SurveyResultEntity e = mapper.toEntity(7L, scored);

            assertThat(e.instrumentKind()).isEqualTo(ins.kind());
            assertThat(e.responses()).as(ins.name()).containsExactlyEntriesOf(scored.responses());
            assertThat(e.recomputeTotal()).isEqualTo(scored.totalSum());
            assertThat(e.getTotalSum()).isEqualTo(scored.totalSum());
            assertThat(e.getUserId()).isEqualTo(7L);
            assertThat(e.getBandCode()).isEqualTo(scored.band().code());
            assertThat(e.getQuestionMn()).isEqualTo(scored.band().label());
        }
    }

    @Test
    void entity_type_follows_instrument() {
        assertThat(mapper.toEntity(1L, engine.evaluate("isma", distinct(registry.get("isma")))))
                .isInstanceOf(IsmaResultEntity.class);
        assertThat(mapper.toEntity(1L, engine.evaluate("insomnia", distinct(registry.get("insomnia")))))
                .isInstanceOf(InsomniaResultEntity.class);
        assertThat(mapper.toEntity(1L, engine.evaluate("fatigue", distinct(registry.get("fatigue")))))
                .isInstanceOf(FatigueResultEntity.class);
    }

    @Test
    void phrase_answer_lands_in_snake_case_column() {
        Map<String, Integer> in = new LinkedHashMap<>();
        registry.get("fatigue").externalKeys().forEach(k -> in.put(k, 0));
        in.put("Neck Shoulder Stiffness", 3);

        FatigueResultEntity e = (FatigueResultEntity) mapper.toEntity(1L, engine.evaluate("fatigue", in));

        assertThat(e.getNeckShoulderStiffness()).isEqualTo(3);
        assertThat(e.getMusclePain()).isZero();
    }

    @Test
    void missing_answer_after_validation_is_a_programming_error() {
        assertThatThrownBy(() -> mapper.toInsomnia(Map.of("fall_asleep", 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("stay_asleep");
    }
}
