package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;

public record CoverageStatus(
    String ndc,
    String drugName,
    boolean covered,
    Integer tier,
    String tierName,
    BigDecimal copay,
    Integer coinsurance,
    boolean requiresPa,
    boolean stepTherapy,
    String quantityLimit,
    String message
) {

    public static CoverageStatus notFound(String ndc) {
        return new CoverageStatus(ndc, null, false, null, null, null, null, false, false, null,
                "NDC " + ndc + " is not on the formulary");
    }
}
