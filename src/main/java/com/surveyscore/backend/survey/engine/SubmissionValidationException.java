package com.surveyscore.backend.survey.engine;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 回答 key 跟問卷題目對不上（缺題 / 多題 / 重複）或回答值不合法。
 * 所有問題一次帶回，讓 App 可以一次修正。
 */
@Getter
public class SubmissionValidationException extends RuntimeException {
    private final String instrumentName;
    private final List<String> missingQuestions;
    private final List<String> unexpectedQuestions;
    private final List<String> duplicateQuestions;
    private final List<String> invalidResponses;

    public SubmissionValidationException(String instrumentName,
                                         List<String> missingQuestions,
                                         List<String> unexpectedQuestions,
                                         List<String> duplicateQuestions,
                                         List<String> invalidResponses) {
        super(buildMessage(instrumentName, missingQuestions, unexpectedQuestions, duplicateQuestions, invalidResponses));
        this.instrumentName = instrumentName;
        this.missingQuestions = List.copyOf(missingQuestions);
        this.unexpectedQuestions = List.copyOf(unexpectedQuestions);
        this.duplicateQuestions = List.copyOf(duplicateQuestions);
        this.invalidResponses = List.copyOf(invalidResponses);
    }

    private static String buildMessage(String instrumentName,
                                       List<String> missing,
                                       List<String> unexpected,
                                       List<String> duplicate,
                                       List<String> invalid) {
        List<String> parts = new ArrayList<>();
        if (!missing.isEmpty()) parts.add("missing=" + missing);
        if (!unexpected.isEmpty()) parts.add("unexpected=" + unexpected);
        if (!duplicate.isEmpty()) parts.add("duplicate=" + duplicate);
        if (!invalid.isEmpty()) parts.add("invalid=" + invalid);
        return "Missing or extra questions in " + instrumentName + " submission: " + String.join(", ", parts);
    }
}
