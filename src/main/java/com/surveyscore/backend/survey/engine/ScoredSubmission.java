package com.surveyscore.backend.survey.engine;

import com.surveyscore.backend.survey.instrument.Instrument;
import com.surveyscore.backend.survey.instrument.ScoreBand;

import java.util.Map;

/**
 * 評分結果（尚未入庫）。
 *
 * @param responses canonical id → 回答，題目順序
 */
public record ScoredSubmission(
        Instrument instrument,
        Map<String, Integer> responses,
        int totalSum,
        ScoreBand band
) {
    public String label() {
        return band.label();
    }
}
