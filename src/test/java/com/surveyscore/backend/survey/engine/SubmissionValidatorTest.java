package com.surveyscore.backend.survey.engine;

import com.surveyscore.backend.survey.instrument.Instrument;
import com.surveyscore.backend.survey.instrument.InstrumentCatalog;
import com.surveyscore.backend.testsupport.SurveyFixtures;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SubmissionValidatorTest {

    private final SubmissionValidator validator = new SubmissionValidator(true);

    @Test
    void complete_isma_submission_passes_in_question_order() {
        Instrument isma = InstrumentCatalog.isma();
        Map<String, Integer> in = new HashMap<>(SurveyFixtures.allCanonical(isma, 1));

        ValidatedSubmission v = validator.validate(in, isma);

        assertThat(v.instrument()).isSameAs(isma);
        assertThat(v.responses().keySet()).containsExactlyElementsOf(isma.questionIds());
        assertThatThrownBy(() -> v.responses().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void phrase_keys_are_normalized_before_checking() {
        Instrument insomnia = InstrumentCatalog.insomnia();

        ValidatedSubmission v = validator.validate(SurveyFixtures.allExternal(insomnia, 2), insomnia);

        assertThat(v.responses()).containsEntry("fall_asleep", 2).containsEntry("sleep_concern", 2).hasSize(7);
    }

    @Test
    void removing_any_single_question_is_rejected_for_every_instrument() {
        for (Instrument ins : InstrumentCatalog.defaults()) {
            Map<String, Integer> full = SurveyFixtures.allExternal(ins, 1);
            for (String key : full.keySet()) {
                Map<String, Integer> in = new LinkedHashMap<>(full);
                in.remove(key);
                String canonical = ins.canonicalize(key).orElseThrow();

                assertThatThrownBy(() -> validator.validate(in, ins))
                        .as(ins.name() + " without " + key)
                        .isInstanceOfSatisfying(SubmissionValidationException.class, e -> {
                            assertThat(e.getMissingQuestions()).containsExactly(canonical);
                            assertThat(e.getUnexpectedQuestions()).isEmpty();
                            assertThat(e.getInstrumentName()).isEqualTo(ins.name());
                        });
            }
        }
    }

    @Test
    void adding_an_unknown_key_is_rejected_for_every_instrument() {
        for (Instrument ins : InstrumentCatalog.defaults()) {
            Map<String, Integer> in = new LinkedHashMap<>(SurveyFixtures.allExternal(ins, 1));
            in.put("extra_question", 1);

            assertThatThrownBy(() -> validator.validate(in, ins))
                    .as(ins.name())
                    .isInstanceOfSatisfying(SubmissionValidationException.class, e -> {
                        assertThat(e.getUnexpectedQuestions()).containsExactly("extra_question");
                        assertThat(e.getMissingQuestions()).isEmpty();
                        assertThat(e.getMessage()).startsWith("Missing or extra questions in " + ins.name());
                    });
        }
    }

    @Test
    void reports_missing_and_unexpected_together() {
        Instrument insomnia = InstrumentCatalog.insomnia();
        Map<String, Integer> in = new LinkedHashMap<>(SurveyFixtures.allExternal(insomnia, 1));
        in.remove("Daily Impact");
        in.remove("Fall Asleep");
        in.put("fall asleep", 1);   // 大小寫不對，不猜

        assertThatThrownBy(() -> validator.validate(in, insomnia))
                .isInstanceOfSatisfying(SubmissionValidationException.class, e -> {
                    // 缺題照題目順序
                    assertThat(e.getMissingQuestions()).containsExactly("fall_asleep", "daily_impact");
                    assertThat(e.getUnexpectedQuestions()).containsExactly("fall asleep");
                });
    }

    @Test
    void alias_and_canonical_for_same_question_is_duplicate() {
        Instrument fatigue = InstrumentCatalog.fatigue();
        Map<String, Integer> in = new LinkedHashMap<>(SurveyFixtures.allExternal(fatigue, 1));
        in.put("head_pain", 3);

        assertThatThrownBy(() -> validator.validate(in, fatigue))
                .isInstanceOfSatisfying(SubmissionValidationException.class, e -> {
                    assertThat(e.getDuplicateQuestions()).containsExactly("head_pain");
                    assertThat(e.getMissingQuestions()).isEmpty();
                });
    }

    @Test
    void negative_and_null_values_are_invalid() {
        Instrument isma = InstrumentCatalog.isma();
        Map<String, Integer> in = new LinkedHashMap<>(SurveyFixtures.allCanonical(isma, 0));
        in.put("overthinking", -1);
        in.put("addiction", null);

        assertThatThrownBy(() -> validator.validate(in, isma))
                .isInstanceOfSatisfying(SubmissionValidationException.class, e -> {
                    assertThat(e.getInvalidResponses()).containsExactlyInAnyOrder("overthinking", "addiction");
                    assertThat(e.getMissingQuestions()).isEmpty();
                });
    }

    @Test
    void negative_values_allowed_when_flag_is_off() {
        SubmissionValidator lenient = new SubmissionValidator(false);
        Instrument isma = InstrumentCatalog.isma();
        Map<String, Integer> in = new LinkedHashMap<>(SurveyFixtures.allCanonical(isma, 0));
        in.put("overthinking", -2);

        assertThat(lenient.validate(in, isma).responses()).containsEntry("overthinking", -2);

        // null 不管旗標都擋
        in.put("addiction", null);
        assertThatThrownBy(() -> lenient.validate(in, isma)).isInstanceOf(SubmissionValidationException.class);
    }

    @Test
    void empty_or_null_responses_list_every_question_as_missing() {
        Instrument insomnia = InstrumentCatalog.insomnia();

        assertThatThrownBy(() -> validator.validate(null, insomnia))
                .isInstanceOfSatisfying(SubmissionValidationException.class,
                        e -> assertThat(e.getMissingQuestions()).containsExactlyElementsOf(insomnia.questionIds()));

        assertThatThrownBy(() -> validator.validate(Map.of(), insomnia))
                .isInstanceOf(SubmissionValidationException.class);
    }
}
