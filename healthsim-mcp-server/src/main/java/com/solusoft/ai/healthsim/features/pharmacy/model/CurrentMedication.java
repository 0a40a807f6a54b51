package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.time.LocalDate;

/**
 * A medication the patient is already taking. Fill date and days supply are optional
 * and only used for the early refill check.
 */
public record CurrentMedication(
    String ndc,
    String gpi,
    String name,
    LocalDate fillDate,
    Integer daysSupply
) {

    public static CurrentMedication of(String ndc, String gpi, String name) {
        return new CurrentMedication(ndc, gpi, name, null, null);
    }
}
