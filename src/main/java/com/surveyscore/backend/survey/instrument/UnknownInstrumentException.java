package com.surveyscore.backend.survey.instrument;

import lombok.Getter;

@Getter
public class UnknownInstrumentException extends RuntimeException {
    private final String instrumentName;

    public UnknownInstrumentException(String instrumentName) {
        super("UNKNOWN_INSTRUMENT");
        this.instrumentName = instrumentName;
    }
}
