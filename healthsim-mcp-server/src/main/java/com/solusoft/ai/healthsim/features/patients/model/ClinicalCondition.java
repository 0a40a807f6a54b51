package com.solusoft.ai.healthsim.features.patients.model;

import java.util.List;

/**
 * Catalog entry for a condition the generator can place on a chart.
 */
public record ClinicalCondition(
    String key,
    String icd10Code,
    String description,
    List<MedicationTemplate> medications,
    List<LabTemplate> labs
) {}
