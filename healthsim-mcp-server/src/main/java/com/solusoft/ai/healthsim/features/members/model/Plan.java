package com.solusoft.ai.healthsim.features.members.model;

import java.math.BigDecimal;

/**
 * Benefit design of a medical plan. Amounts in dollars, coinsurance as a whole percent.
 */
public record Plan(
    String code,
    String name,
    PlanType planType,
    BigDecimal deductibleIndividual,
    BigDecimal deductibleFamily,
    BigDecimal oopMaxIndividual,
    BigDecimal oopMaxFamily,
    BigDecimal pcpCopay,
    BigDecimal specialistCopay,
    BigDecimal erCopay,
    int coinsurancePercent
) {}
