package com.surveyscore.backend.survey.engine;

import com.surveyscore.backend.survey.instrument.Instrument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通過驗證的回答：key 已轉成 canonical id，順序跟題目順序一致。
 * 只有 {@link SubmissionValidator} 能建立。
 */
public final class ValidatedSubmission {

    private final Instrument instrument;
    private final Map<String, Integer> responses;

    ValidatedSubmission(Instrument instrument, LinkedHashMap<String, Integer> responses) {
        this.instrument = instrument;
        this.responses = Collections.unmodifiableMap(responses);
    }

    public Instrument instrument() { return instrument; }

    public Map<String, Integer> responses() { return responses; }
}
