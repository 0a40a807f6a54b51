package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;

/**
 * A formulary entry. {@code stepTherapyPrerequisiteGpi} is a GPI prefix a prior fill must match;
 * {@code quantityLimit} units are allowed per {@code quantityLimitDays} days.
 */
public record FormularyDrug(
    String ndc,
    String gpi,
    String name,
    int tier,
    boolean covered,
    boolean requiresPa,
    boolean stepTherapy,
    String stepTherapyPrerequisiteGpi,
    Integer quantityLimit,
    Integer quantityLimitDays,
    BigDecimal maxDailyUnits
) {

    public boolean hasQuantityLimit() {
        return quantityLimit != null && quantityLimitDays != null;
    }
}
