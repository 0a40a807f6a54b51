package com.solusoft.ai.healthsim.features.members.model;

/**
 * HCR01 certification action.
 */
public enum ReviewAction {
    CERTIFIED("A1"),
    NOT_CERTIFIED("A3");

    private final String hcrCode;

    ReviewAction(String hcrCode) {
        this.hcrCode = hcrCode;
    }

    public String hcrCode() {
        return hcrCode;
    }
}
