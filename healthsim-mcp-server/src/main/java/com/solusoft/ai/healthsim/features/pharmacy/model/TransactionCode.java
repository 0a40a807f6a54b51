package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.util.Locale;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;

/**
 * NCPDP transaction codes.
 */
public enum TransactionCode {
    B1("Billing"),
    B2("Reversal"),
    B3("Rebill");

    private final String description;

    TransactionCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public static TransactionCode parse(String value) {
        if (value == null || value.isBlank()) {
            return B1;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported transaction code: " + value);
        }
    }
}
