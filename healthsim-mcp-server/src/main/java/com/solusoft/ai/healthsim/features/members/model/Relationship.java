package com.solusoft.ai.healthsim.features.members.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relationship to the subscriber, with the X12 individual relationship code (INS02 / SBR02 / PAT01).
 */
public enum Relationship {
    SELF("18"),
    SPOUSE("01"),
    CHILD("19");

    private final String x12Code;

    Relationship(String x12Code) {
        this.x12Code = x12Code;
    }

    public String x12Code() {
        return x12Code;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
