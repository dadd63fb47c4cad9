package com.surveyscore.backend.survey.engine;

/**
 * 總分 = 各題回答直接相加（沒有權重、沒有正規化）。
 * 只吃驗證過的回答。
 */
public class Scorer {

    public int score(ValidatedSubmission submission) {
        int sum = 0;
        for (Integer v : submission.responses().values()) {
            try {
                sum = Math.addExact(sum, v);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("TOTAL_SUM_OVERFLOW", e);
            }
        }
        return sum;
    }
}
