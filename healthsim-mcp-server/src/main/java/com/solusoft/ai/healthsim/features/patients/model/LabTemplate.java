package com.solusoft.ai.healthsim.features.patients.model;

/**
 * Catalog definition of a lab or vital: normal range plus the range drawn when the result is abnormal.
 */
public record LabTemplate(
    String loincCode,
    String display,
    String unit,
    double normalLow,
    double normalHigh,
    double abnormalLow,
    double abnormalHigh,
    int scale
) {}
