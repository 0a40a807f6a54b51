package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.solusoft.ai.healthsim.common.model.Gender;

import lombok.Builder;

@Builder
public record DurRequest(
    String ndc,
    String gpi,
    String drugName,
    String memberId,
    LocalDate serviceDate,
    List<CurrentMedication> currentMedications,
    int patientAge,
    Gender patientGender,
    BigDecimal quantity,
    Integer daysSupply
) {

    public List<CurrentMedication> currentMedications() {
        return currentMedications == null ? List.of() : currentMedications;
    }
}
