package com.solusoft.ai.healthsim.features.pharmacy.model;

/**
 * DUR conflict types with the NCPDP reason-for-service code sent in the response (439-E4).
 */
public enum DurAlertType {
    DD("Drug-Drug Interaction", "DD"),
    TD("Therapeutic Duplication", "TD"),
    ER("Early Refill", "ER"),
    HD("High Dose", "HD"),
    DA("Drug-Age", "PA"),
    DG("Drug-Gender", "SX");

    private final String description;
    private final String reasonForServiceCode;

    DurAlertType(String description, String reasonForServiceCode) {
        this.description = description;
        this.reasonForServiceCode = reasonForServiceCode;
    }

    public String description() {
        return description;
    }

    public String reasonForServiceCode() {
        return reasonForServiceCode;
    }
}
