package com.solusoft.ai.healthsim.features.members.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClaimStatus {
    PAID, DENIED, PENDING;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
