package com.solusoft.ai.healthsim.features.patients.model;

import java.util.List;

import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Gender;

/**
 * Optional constraints for patient generation; every non-null field applies.
 */
public record PatientConstraints(
    AgeRange ageRange,
    Gender gender,
    List<String> conditions,
    String scenario
) {

    public static PatientConstraints none() {
        return new PatientConstraints(null, null, List.of(), null);
    }

    public static PatientConstraints scenario(String scenario) {
        return new PatientConstraints(null, null, List.of(), scenario);
    }

    public static PatientConstraints conditions(String... conditions) {
        return new PatientConstraints(null, null, List.of(conditions), null);
    }

    public List<String> conditions() {
        return conditions == null ? List.of() : conditions;
    }
}
