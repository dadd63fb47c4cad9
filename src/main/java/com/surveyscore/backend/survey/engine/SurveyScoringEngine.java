package com.surveyscore.backend.survey.engine;

import com.surveyscore.backend.survey.instrument.Instrument;
import com.surveyscore.backend.survey.instrument.InstrumentRegistry;
import com.surveyscore.backend.survey.instrument.ScoreBand;

import java.util.Map;

/**
 * registry → validate → score → classify。
 * 驗證沒過就不會算分；整個流程沒有副作用，可以多執行緒共用。
 */
public class SurveyScoringEngine {

    private final InstrumentRegistry registry;
    private final SubmissionValidator validator;
    private final Scorer scorer;
    private final Classifier classifier;

    public SurveyScoringEngine(InstrumentRegistry registry, SubmissionValidator validator, Scorer scorer, Classifier classifier) {
        this.registry = registry;
        this.validator = validator;
        this.scorer = scorer;
        this.classifier = classifier;
    }

    public ScoredSubmission evaluate(String instrumentName, Map<String, Integer> responses) {
        Instrument instrument = registry.get(instrumentName);
        ValidatedSubmission validated = validator.validate(responses, instrument);
        int total = scorer.score(validated);
        ScoreBand band = classifier.classify(total, instrument);
        return new ScoredSubmission(instrument, validated.responses(), total, band);
    }

    public InstrumentRegistry registry() {
        return registry;
    }
}
