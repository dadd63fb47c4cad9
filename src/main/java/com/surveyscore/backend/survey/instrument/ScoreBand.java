package com.surveyscore.backend.survey.instrument;

/**
 * 分數區間 [low, high]（兩端都含）。
 * low = Integer.MIN_VALUE 表示下方無界，high = Integer.MAX_VALUE 表示上方無界。
 *
 * @param code  穩定的英文代碼（API / DB 用）
 * @param label 原文標籤，原樣保存（目前為蒙古文）
 */
public record ScoreBand(int low, int high, String code, String label) {

    public ScoreBand {
        if (low > high) throw new IllegalArgumentException("BAND_LOW_GT_HIGH: " + code);
        if (code == null || code.isBlank()) throw new IllegalArgumentException("BAND_CODE_REQUIRED");
        if (label == null || label.isBlank()) throw new IllegalArgumentException("BAND_LABEL_REQUIRED: " + code);
    }

    public boolean contains(int totalSum) {
        return totalSum >= low && totalSum <= high;
    }

    public boolean unboundedBelow() {
        return low == Integer.MIN_VALUE;
    }

    public boolean unboundedAbove() {
        return high == Integer.MAX_VALUE;
    }
}
