package com.solusoft.ai.healthsim.common.model;

import java.util.Locale;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;

/**
 * Administrative gender as carried by every HealthSim person.
 */
public enum Gender {
    M("male", "1"),
    F("female", "2");

    private final String fhirCode;
    private final String ncpdpCode;

    Gender(String fhirCode, String ncpdpCode) {
        this.fhirCode = fhirCode;
        this.ncpdpCode = ncpdpCode;
    }

    public String fhirCode() {
        return fhirCode;
    }

    public String ncpdpCode() {
        return ncpdpCode;
    }

    /**
     * Accepts "M"/"F" as well as "male"/"female". Blank input yields null (no constraint).
     */
    public static Gender parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "m":
            case "male":
                return M;
            case "f":
            case "female":
                return F;
            default:
                throw new InvalidRequestException("Unsupported gender: " + value);
        }
    }
}
