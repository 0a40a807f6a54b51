package com.solusoft.ai.healthsim.features.patients.model;

public enum ObservationCategory {
    VITAL_SIGNS("vital-signs", "Vital Signs"),
    LABORATORY("laboratory", "Laboratory");

    private final String code;
    private final String display;

    ObservationCategory(String code, String display) {
        this.code = code;
        this.display = display;
    }

    public String code() {
        return code;
    }

    public String display() {
        return display;
    }
}
