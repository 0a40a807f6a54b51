package com.solusoft.ai.healthsim.features.patients.model;

public record MedicationTemplate(
    String name,
    String dose,
    String frequency,
    String route,
    String rxNormCode,
    String ndc
) {}
