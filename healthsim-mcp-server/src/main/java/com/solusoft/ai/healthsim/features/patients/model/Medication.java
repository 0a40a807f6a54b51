package com.solusoft.ai.healthsim.features.patients.model;

import java.time.LocalDate;

public record Medication(
    String name,
    String dose,
    String frequency,
    String route,
    String rxNormCode,
    String ndc,
    LocalDate startDate
) {}
