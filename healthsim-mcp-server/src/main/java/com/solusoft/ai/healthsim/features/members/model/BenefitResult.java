package com.solusoft.ai.healthsim.features.members.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of running claim lines through a plan's cost sharing.
 */
public record BenefitResult(
    List<ClaimLine> lines,
    BigDecimal allowed,
    BigDecimal paid,
    BigDecimal deductible,
    BigDecimal copay,
    BigDecimal coinsurance
) {

    public BigDecimal patientResponsibility() {
        return deductible.add(copay).add(coinsurance);
    }
}
