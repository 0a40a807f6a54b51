package com.solusoft.ai.healthsim.features.members.format;

import java.util.Locale;

import com.solusoft.ai.healthsim.exception.UnknownReferenceException;

/**
 * Transaction sets HealthSim emits, with their GS01 functional identifier and 005010 implementation guide.
 */
public enum X12TransactionType {
    ENROLLMENT_834("834", "BE", "005010X220A1"),
    PROFESSIONAL_CLAIM_837P("837", "HC", "005010X222A1"),
    REMITTANCE_835("835", "HP", "005010X221A1"),
    ELIGIBILITY_INQUIRY_270("270", "HS", "005010X279A1"),
    ELIGIBILITY_RESPONSE_271("271", "HB", "005010X279A1"),
    SERVICES_REVIEW_278("278", "HI", "005010X217");

    private final String transactionSetId;
    private final String functionalId;
    private final String implementationReference;

    X12TransactionType(String transactionSetId, String functionalId, String implementationReference) {
        this.transactionSetId = transactionSetId;
        this.functionalId = functionalId;
        this.implementationReference = implementationReference;
    }

    public String transactionSetId() {
        return transactionSetId;
    }

    public String functionalId() {
        return functionalId;
    }

    public String implementationReference() {
        return implementationReference;
    }

    /**
     * Accepts "834", "837", "837P", "835", "270", "271", "278".
     */
    public static X12TransactionType parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "834":
                return ENROLLMENT_834;
            case "837":
            case "837P":
                return PROFESSIONAL_CLAIM_837P;
            case "835":
                return REMITTANCE_835;
            case "270":
                return ELIGIBILITY_INQUIRY_270;
            case "271":
                return ELIGIBILITY_RESPONSE_271;
            case "278":
                return SERVICES_REVIEW_278;
            default:
                throw new UnknownReferenceException("transaction type", value);
        }
    }
}
