package com.surveyscore.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 全站兜底：把常見例外轉成「可預期」的 HTTP 狀態碼與錯誤格式。
 * - 400：參數格式錯 / Bean Validation / IllegalArgument（帳號重複等）
 * - 404：找不到資源
 * - 500：其他未預期錯誤
 * 問卷相關有自己的 SurveyExceptionAdvice，優先權比這裡高。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err(code(ex.getMessage(), "BAD_REQUEST"), ex.getMessage(), req));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("MALFORMED_JSON", "Request body could not be parsed", req));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadParam(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    /**
     * Bean Validation（@Valid）失敗：同一欄位只留第一個訊息
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        Map<String, Object> body = err("VALIDATION_FAILED", "Validation failed", req);
        body.put("fields", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    // ===== 404 Not Found =====

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuch(NoSuchElementException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err(code(ex.getMessage(), "NOT_FOUND"), ex.getMessage(), req));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        // Spring MVC 自己的例外（405 / 404 no handler 等）保留原本狀態碼
        if (ex instanceof ErrorResponse er) {
            return ResponseEntity.status(er.getStatusCode())
                    .body(err(HttpStatus.valueOf(er.getStatusCode().value()).name(), null, req));
        }
        String rid = RequestIdFilter.getOrCreate(req);
        log.error("RID={} {} {} failed", rid, req.getMethod(), req.getRequestURI(), ex);
        // 不回 exception message，避免洩漏內部資訊
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", null, req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }

    private static String code(String msg, String fallback) {
        return (msg == null || msg.isBlank()) ? fallback : msg.trim();
    }
}
