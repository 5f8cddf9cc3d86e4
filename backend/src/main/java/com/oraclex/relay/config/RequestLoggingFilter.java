package com.oraclex.relay.config;

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
import java.util.Set;
import java.util.UUID;

/**
 * Tags every relay call with request and correlation ids (MDC and response headers) and
 * writes one access line when it completes.
 */
@Component
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_KEY = "requestId";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String ROUTE_KEY = "route";

    // Dashboard and execution agent poll these several times a second
    static final Set<String> POLLED_PATHS = Set.of("/last-signal", "/get-market-state");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String path = request.getRequestURI();
        String requestId = headerOr(request.getHeader(REQUEST_ID_HEADER), null);
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        // A caller that does not correlate its calls gets one id per request, not two
        String correlationId = headerOr(request.getHeader(CORRELATION_ID_HEADER), requestId);

        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        MDC.put(ROUTE_KEY, request.getMethod() + " " + path);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            if (POLLED_PATHS.contains(path) && response.getStatus() < 400) {
                log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), path, response.getStatus(), durationMs);
            } else {
                log.info("HTTP {} {} -> {} ({} ms)", request.getMethod(), path, response.getStatus(), durationMs);
            }
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CORRELATION_ID_KEY);
            MDC.remove(ROUTE_KEY);
        }
    }

    private static String headerOr(String value, String fallback) {
        return (value == null || value.isBlank()) ? fallback : value.trim();
    }
}
