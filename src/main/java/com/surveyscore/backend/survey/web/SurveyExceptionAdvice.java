package com.surveyscore.backend.survey.web;

import com.surveyscore.backend.common.web.RequestIdFilter;
import com.surveyscore.backend.survey.controller.SurveyController;
import com.surveyscore.backend.survey.dto.SurveyErrorResponse;
import com.surveyscore.backend.survey.engine.NoMatchingBandException;
import com.surveyscore.backend.survey.engine.SubmissionValidationException;
import com.surveyscore.backend.survey.instrument.BandTableMisconfiguredException;
import com.surveyscore.backend.survey.instrument.UnknownInstrumentException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.NoSuchElementException;

@Slf4j
@RestControllerAdvice(assignableTypes = SurveyController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class SurveyExceptionAdvice {

    @ExceptionHandler(SubmissionValidationException.class)
    public ResponseEntity<SurveyErrorResponse> handleInvalid(SubmissionValidationException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new SurveyErrorResponse(
                "SUBMISSION_INVALID",
                e.getMessage(),
                rid(req),
                e.getInstrumentName(),
                e.getMissingQuestions(),
                e.getUnexpectedQuestions(),
                e.getDuplicateQuestions(),
                e.getInvalidResponses()
        ));
    }

    @ExceptionHandler(UnknownInstrumentException.class)
    public ResponseEntity<SurveyErrorResponse> handleUnknown(UnknownInstrumentException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new SurveyErrorResponse(
                "UNKNOWN_INSTRUMENT",
                "Unknown instrument: " + e.getInstrumentName(),
                rid(req),
                e.getInstrumentName(),
                null, null, null, null
        ));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<SurveyErrorResponse> handleNoSuch(NoSuchElementException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "NOT_FOUND");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new SurveyErrorResponse(code, code, rid(req)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<SurveyErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new SurveyErrorResponse(code, code, rid(req)));
    }

    /** JSON 壞掉、回答不是整數（例如 1.5 或 "a"） */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<SurveyErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SurveyErrorResponse("MALFORMED_SUBMISSION", "Request body is not a valid survey submission", rid(req)));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SurveyErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        String msg = e.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : e.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new SurveyErrorResponse("VALIDATION_FAILED", msg, rid(req)));
    }

    /** 區間表設定壞了，屬於伺服器錯；其他 IllegalStateException 交給 ApiExceptionHandler */
    @ExceptionHandler({NoMatchingBandException.class, BandTableMisconfiguredException.class})
    public ResponseEntity<SurveyErrorResponse> handleBandTable(IllegalStateException e, HttpServletRequest req) {
        String rid = rid(req);
        log.error("[Survey] RID={} {} {} failed", rid, req.getMethod(), req.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new SurveyErrorResponse("SCORING_CONFIGURATION_ERROR", norm(e.getMessage(), "ILLEGAL_STATE"), rid));
    }

    // ===== helpers =====

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }
}
