package com.surveyscore.backend.survey.instrument;

import lombok.Getter;

import java.util.List;

/**
 * 問卷設定錯誤（區間有洞 / 重疊 / 題目重複）。只會在啟動檢查時丟出。
 */
@Getter
public class BandTableMisconfiguredException extends IllegalStateException {
    private final String instrumentName;
    private final List<String> problems;

    public BandTableMisconfiguredException(String instrumentName, List<String> problems) {
        super("BAND_TABLE_MISCONFIGURED: " + instrumentName + " " + String.join("; ", problems));
        this.instrumentName = instrumentName;
        this.problems = List.copyOf(problems);
    }
}
