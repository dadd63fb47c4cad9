package com.surveyscore.backend.survey.engine;

/**
 * 分數找不到對應區間：代表區間表設定壞了，不是使用者輸入錯。
 */
public class NoMatchingBandException extends IllegalStateException {

    public NoMatchingBandException(String instrumentName, int totalSum) {
        super("NO_MATCHING_BAND: " + instrumentName + " total_sum=" + totalSum);
    }
}
