package com.solusoft.ai.healthsim.aspect;

import java.time.Duration;
import java.time.Instant;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Audit trail for every {@code @McpTool} invocation: caller, tool, outcome and elapsed time.
 * Tools report input errors as {@code "success":false} payloads rather than exceptions, so those
 * are logged as rejected calls.
 */
@Aspect
@Component
@Slf4j
public class McpAuditAspect {

    private static final String FAILURE_MARKER = "\"success\":false";

    @Around("@annotation(org.springaicommunity.mcp.annotation.McpTool)")
    public Object auditToolCall(ProceedingJoinPoint joinPoint) throws Throwable {

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String user = (auth != null) ? auth.getName() : "Anonymous";
        String authorities = (auth != null) ? auth.getAuthorities().toString() : "[]";
        String toolName = joinPoint.getSignature().getName();

        log.info("[AUDIT START] User='{}' Role={} Tool='{}'", user, authorities, toolName);

        Instant start = Instant.now();
        try {
            Object result = joinPoint.proceed();
            long timeTaken = Duration.between(start, Instant.now()).toMillis();
            if (result instanceof String && ((String) result).startsWith("{" + FAILURE_MARKER)) {
                log.warn("[AUDIT REJECTED] User='{}' Tool='{}' Time={}ms", user, toolName, timeTaken);
            } else {
                log.info("[AUDIT SUCCESS] User='{}' Tool='{}' Time={}ms", user, toolName, timeTaken);
            }
            return result;
        } catch (Throwable ex) {
            log.error("[AUDIT FAILURE] User='{}' Tool='{}' Error='{}'", user, toolName, ex.getMessage());
            throw ex;
        }
    }
}
