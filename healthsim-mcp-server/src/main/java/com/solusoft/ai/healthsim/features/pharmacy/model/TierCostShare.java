package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;

/**
 * Member cost share for a formulary tier: either a flat copay or a coinsurance percent.
 */
public record TierCostShare(
    int tier,
    String name,
    BigDecimal copay,           // null for coinsurance tiers
    Integer coinsurancePercent, // null for copay tiers
    boolean appliesDeductible
) {

    public boolean isCoinsurance() {
        return coinsurancePercent != null;
    }
}
