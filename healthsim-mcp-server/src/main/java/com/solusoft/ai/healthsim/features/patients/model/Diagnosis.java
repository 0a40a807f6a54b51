package com.solusoft.ai.healthsim.features.patients.model;

import java.time.LocalDate;

public record Diagnosis(
    String code, // ICD-10-CM
    String description,
    LocalDate onsetDate,
    boolean chronic
) {}
