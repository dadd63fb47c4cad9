package com.surveyscore.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 每個請求帶一個 request id：沿用 App 送來的 X-Request-Id，沒有就產生。
 * 寫進 MDC（log pattern 的 %X{rid}）並回傳在 response header。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final int MAX_LEN = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        long startNs = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} ({} ms)", req.getMethod(), req.getRequestURI(), res.getStatus(),
                        (System.nanoTime() - startNs) / 1_000_000);
            }
            MDC.remove(MDC_KEY);
        }
    }

    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }

    // header 是外部輸入：空白 / 過長就換掉，避免 log 被灌
    static String sanitize(String raw) {
        if (raw == null || raw.isBlank() || raw.length() > MAX_LEN) return UUID.randomUUID().toString();
        return raw.trim();
    }
}
