package com.solusoft.ai.healthsim.features.members.model;

import java.math.BigDecimal;

public record ClaimLine(
    int lineNumber,
    String cptCode,
    int units,
    BigDecimal charge,
    BigDecimal allowed,
    BigDecimal paid,
    BigDecimal deductible,
    BigDecimal copay,
    BigDecimal coinsurance
) {

    public BigDecimal patientResponsibility() {
        return deductible.add(copay).add(coinsurance);
    }

    public static ClaimLine unadjudicated(int lineNumber, String cptCode, int units, BigDecimal charge, BigDecimal allowed) {
        return new ClaimLine(lineNumber, cptCode, units, charge, allowed,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
