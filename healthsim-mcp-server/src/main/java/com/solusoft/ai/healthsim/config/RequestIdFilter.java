package com.solusoft.ai.healthsim.config;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Tags each request with a trace id, taken from {@code X-Request-ID} when the client supplies one,
 * and exposes it to log lines through the MDC and to the client through the response header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String MDC_KEY = "trace_id";
    public static final String HEADER_KEY = "X-Request-ID";

    private static final int MAX_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = sanitize(request.getHeader(HEADER_KEY));
        try {
            MDC.put(MDC_KEY, requestId);
            response.setHeader(HEADER_KEY, requestId);
            filterChain.doFilter(request, response);
        } finally {
            // pooled threads
            MDC.remove(MDC_KEY);
        }
    }

    static String sanitize(String candidate) {
        if (candidate == null || candidate.isBlank() || candidate.length() > MAX_LENGTH
                || !candidate.matches("[A-Za-z0-9._-]+")) {
            return UUID.randomUUID().toString();
        }
        return candidate;
    }
}
