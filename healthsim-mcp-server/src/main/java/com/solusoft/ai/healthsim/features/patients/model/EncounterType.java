package com.solusoft.ai.healthsim.features.patients.model;

public enum EncounterType {
    OUTPATIENT("AMB", "ambulatory", "O"),
    INPATIENT("IMP", "inpatient encounter", "I"),
    EMERGENCY("EMER", "emergency", "E"),
    WELLNESS("AMB", "ambulatory", "O");

    private final String actCode;
    private final String actDisplay;
    private final String patientClass;

    EncounterType(String actCode, String actDisplay, String patientClass) {
        this.actCode = actCode;
        this.actDisplay = actDisplay;
        this.patientClass = patientClass;
    }

    /** HL7 v3 ActCode used as the FHIR Encounter.class. */
    public String actCode() {
        return actCode;
    }

    public String actDisplay() {
        return actDisplay;
    }

    /** PV1-2 patient class. */
    public String patientClass() {
        return patientClass;
    }
}
