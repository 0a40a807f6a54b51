package com.solusoft.ai.healthsim.features.pharmacy.model;

/**
 * A DUR finding. Severity 1 is contraindicated, 2 serious, 3 moderate.
 */
public record DurAlert(
    DurAlertType alertType,
    int severity,
    String message,
    String conflictingDrug
) {}
