package com.solusoft.ai.healthsim.features.pharmacy.model;

public record Reject(String code, String message) {

    public static Reject of(RejectCode code) {
        return new Reject(code.getCode(), code.getMessage());
    }

    public static Reject of(RejectCode code, String detail) {
        return new Reject(code.getCode(), code.getMessage() + ": " + detail);
    }
}
