package com.surveyscore.backend.survey.instrument;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstrumentKeyNormalizationTest {

    @Test
    void insomnia_phrases_map_to_snake_case_columns() {
        Instrument insomnia = InstrumentCatalog.insomnia();

        assertThat(insomnia.canonicalize("Fall Asleep")).contains("fall_asleep");
        assertThat(insomnia.canonicalize("Sleep Satisfaction")).contains("sleep_satisfaction");
        // canonical id 本身也收
        assertThat(insomnia.canonicalize("life_quality")).contains("life_quality");
    }

    @Test
    void fatigue_multi_word_phrase_maps_to_single_column() {
        Instrument fatigue = InstrumentCatalog.fatigue();

        assertThat(fatigue.canonicalize("Neck Shoulder Stiffness")).contains("neck_shoulder_stiffness");
        assertThat(fatigue.canonicalize("Allergic Reaction")).contains("allergic_reaction");
    }

    @Test
    void unknown_or_differently_cased_keys_are_not_guessed() {
        Instrument insomnia = InstrumentCatalog.insomnia();

        assertThat(insomnia.canonicalize("fall asleep")).isEmpty();
        assertThat(insomnia.canonicalize("Snoring")).isEmpty();
        assertThat(insomnia.canonicalize(null)).isEmpty();
    }

    @Test
    void alias_table_is_total_over_declared_external_keys() {
        for (Instrument ins : InstrumentCatalog.defaults()) {
            assertThat(ins.externalKeys()).as(ins.name()).hasSameSizeAs(ins.questionIds());
            assertThat(ins.externalKeys().stream().map(k -> ins.canonicalize(k).orElseThrow()))
                    .as(ins.name())
                    .containsExactlyElementsOf(ins.questionIds());
        }
    }

    @Test
    void external_keys_are_read_only_for_every_instrument() {
        for (Instrument ins : InstrumentCatalog.defaults()) {
            assertThatThrownBy(() -> ins.externalKeys().add("extra"))
                    .as(ins.name())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    void isma_keys_are_already_canonical() {
        Instrument isma = InstrumentCatalog.isma();

        assertThat(isma.keyAliases()).isEmpty();
        assertThat(isma.externalKeys()).isEqualTo(isma.questionIds());
        assertThat(isma.canonicalize("teeth_grinding")).contains("teeth_grinding");
    }
}
