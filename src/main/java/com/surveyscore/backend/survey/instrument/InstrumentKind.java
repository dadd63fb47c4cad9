package com.surveyscore.backend.survey.instrument;

import java.util.Locale;

public enum InstrumentKind {
    ISMA,
    INSOMNIA,
    FATIGUE;

    /** URL / registry 用的名稱：isma / insomnia / fatigue */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InstrumentKind parse(String raw) {
        if (raw == null) return null;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return InstrumentKind.valueOf(v);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
