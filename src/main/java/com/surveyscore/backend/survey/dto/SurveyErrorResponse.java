package com.surveyscore.backend.survey.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SurveyErrorResponse(
        String code,
        String message,
        String requestId,
        String instrument,
        List<String> missingQuestions,
        List<String> unexpectedQuestions,
        List<String> duplicateQuestions,
        List<String> invalidResponses
) {
    public SurveyErrorResponse(String code, String message, String requestId) {
        this(code, message, requestId, null, null, null, null, null);
    }
}
