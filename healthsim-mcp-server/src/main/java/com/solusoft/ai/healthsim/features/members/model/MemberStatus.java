package com.solusoft.ai.healthsim.features.members.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;

public enum MemberStatus {
    ACTIVE, TERMED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MemberStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported member status: " + value);
        }
    }
}
