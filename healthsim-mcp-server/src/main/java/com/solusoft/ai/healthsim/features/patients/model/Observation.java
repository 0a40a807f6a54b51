package com.solusoft.ai.healthsim.features.patients.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A vital sign or lab result. {@code interpretation} is L, N or H against the reference range.
 */
public record Observation(
    String loincCode,
    String display,
    BigDecimal value,
    String unit, // UCUM
    LocalDate effectiveDate,
    BigDecimal referenceLow,
    BigDecimal referenceHigh,
    String interpretation,
    ObservationCategory category
) {

    public static String interpret(BigDecimal value, BigDecimal low, BigDecimal high) {
        if (low != null && value.compareTo(low) < 0) {
            return "L";
        }
        if (high != null && value.compareTo(high) > 0) {
            return "H";
        }
        return "N";
    }

    public boolean isAbnormal() {
        return !"N".equals(interpretation);
    }
}
