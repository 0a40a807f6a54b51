package com.solusoft.ai.healthsim.features.patients.model;

import java.time.LocalDate;

public record Encounter(
    String encounterId,
    EncounterType type,
    LocalDate admitDate,
    LocalDate dischargeDate,
    String reasonCode,
    String facility,
    String attendingNpi
) {}
