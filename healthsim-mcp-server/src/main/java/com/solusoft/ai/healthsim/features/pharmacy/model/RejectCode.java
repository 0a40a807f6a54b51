package com.solusoft.ai.healthsim.features.pharmacy.model;

import com.fasterxml.jackson.annotation.JsonFormat;

/**
 * NCPDP reject codes used by adjudication.
 */
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum RejectCode {
    MISSING_INVALID_PHARMACY_NUMBER("05", "M/I Pharmacy Number"),
    MISSING_INVALID_GROUP("06", "M/I Group ID"),
    MISSING_INVALID_RX_NUMBER("16", "M/I Prescription/Service Reference Number"),
    MISSING_INVALID_DAYS_SUPPLY("19", "M/I Days Supply"),
    NON_MATCHED_CARDHOLDER("52", "Non-Matched Cardholder ID"),
    PATIENT_NOT_COVERED("65", "Patient Is Not Covered"),
    NOT_COVERED("70", "Product/Service Not Covered"),
    PRIOR_AUTH_REQUIRED("75", "Prior Authorization Required"),
    PLAN_LIMITATIONS_EXCEEDED("76", "Plan Limitations Exceeded"),
    REFILL_TOO_SOON("79", "Refill Too Soon"),
    REVERSAL_NOT_PROCESSED("87", "Reversal Not Processed"),
    DUR_REJECT("88", "DUR Reject Error"),
    STEP_THERAPY("608", "Step Therapy, Alternate Drug Therapy Required Prior To Use Of Submitted Product Service ID"),
    MISSING_INVALID_QUANTITY("E7", "M/I Quantity Dispensed");

    private final String code;
    private final String message;

    RejectCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
