package com.surveyscore.backend.survey.engine;

import com.surveyscore.backend.survey.instrument.Instrument;
import com.surveyscore.backend.survey.instrument.ScoreBand;

public class Classifier {

    /** 依序找第一個包含 totalSum 的區間 */
    public ScoreBand classify(int totalSum, Instrument instrument) {
        for (ScoreBand band : instrument.bands()) {
            if (band.contains(totalSum)) return band;
        }
        throw new NoMatchingBandException(instrument.name(), totalSum);
    }
}
