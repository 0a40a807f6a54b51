package com.solusoft.ai.healthsim.features.patients.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;

/**
 * A synthetic clinical patient with its chart.
 * {@code age} is the age in whole years on the generation date.
 */
public record Patient(
    String patientId,
    String mrn,
    Demographics demographics,
    int age,
    List<Diagnosis> diagnoses,
    List<Encounter> encounters,
    List<Medication> medications,
    List<Observation> observations
) {

    @JsonIgnore
    public String fullName() {
        return demographics.fullName();
    }

    @JsonIgnore
    public Gender gender() {
        return demographics.gender();
    }

    @JsonIgnore
    public List<Observation> labs() {
        return observations.stream().filter(o -> o.category() == ObservationCategory.LABORATORY).toList();
    }
}
