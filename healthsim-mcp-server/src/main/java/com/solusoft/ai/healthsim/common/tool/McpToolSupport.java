package com.solusoft.ai.healthsim.common.tool;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.ai.healthsim.config.HealthSimProperties;
import com.solusoft.ai.healthsim.exception.HealthSimException;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.exception.UnknownReferenceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Plumbing shared by the MCP tool classes: JSON rendering, seed resolution and error payloads.
 */
@Slf4j
public abstract class McpToolSupport {

    protected final ObjectMapper objectMapper;
    protected final HealthSimProperties properties;

    protected McpToolSupport(ObjectMapper objectMapper, HealthSimProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    protected long resolveSeed(Long seed) {
        if (seed != null) {
            return seed;
        }
        Long configured = properties.getGeneration().getDefaultSeed();
        return configured != null ? configured : ThreadLocalRandom.current().nextLong(1, Integer.MAX_VALUE);
    }

    protected int checkCount(Integer count, int fallback) {
        int value = count != null ? count : fallback;
        int max = properties.getGeneration().getMaxBatchSize();
        if (value < 0 || value > max) {
            throw new InvalidRequestException("count must be between 0 and " + max + ", was " + value);
        }
        return value;
    }

    /** Parses yyyy-MM-dd, returning the fallback for blank input. */
    protected static LocalDate parseDate(String name, String value, LocalDate fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(name + " must be yyyy-MM-dd, was " + value);
        }
    }

    protected static List<String> csv(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    protected static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    protected Map<String, Object> success() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        return result;
    }

    protected String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("JSON Serialization Error", e);
            return "{\"success\":false,\"status\":\"FATAL_ERROR\",\"message\":\"JSON_ERROR\"}";
        }
    }

    protected String handleError(String toolName, Exception e) {
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("success", false);
        if (isInputError(e)) {
            log.warn("Rejected input for tool [{}]: {}", toolName, e.getMessage());
            errorResponse.put("status", "INVALID_INPUT");
            errorResponse.put("message", e.getMessage());
            if (e instanceof HealthSimException) {
                errorResponse.put("error_code", ((HealthSimException) e).getErrorCode());
            }
        } else {
            log.error("❌ CRITICAL ERROR in tool [{}]: {}", toolName, e.getMessage(), e);
            errorResponse.put("status", "FATAL_ERROR");
            errorResponse.put("message", "System failure in " + toolName + ". " + e.getMessage());
        }
        return toJson(errorResponse);
    }

    private static boolean isInputError(Exception e) {
        return e instanceof InvalidRequestException
                || e instanceof UnknownReferenceException
                || e instanceof IllegalArgumentException;
    }
}
