package com.solusoft.ai.healthsim.common.model;

import java.time.LocalDate;
import java.time.Period;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record Demographics(
    String firstName,
    String middleName, // may be null
    String lastName,
    LocalDate dateOfBirth,
    Gender gender,
    Address address,
    String phone
) {

    public String fullName() {
        return firstName + " " + lastName;
    }

    @JsonIgnore
    public int ageOn(LocalDate asOf) {
        return Period.between(dateOfBirth, asOf).getYears();
    }
}
