package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.Builder;

/**
 * Clinical information submitted with a prior authorization request. Evidence fields are optional;
 * criteria that need a missing field pend the request.
 */
@Builder
public record PriorAuthRequest(
    String memberId,
    String ndc,
    String prescriberNpi,
    LocalDate requestDate,
    List<String> diagnosisCodes,
    BigDecimal a1c,
    LocalDate a1cDate,
    BigDecimal bmi,
    Integer metforminTrialMonths,
    Boolean failedConventionalTherapy,
    Boolean specialistConfirmed
) {

    public List<String> diagnosisCodes() {
        return diagnosisCodes == null ? List.of() : diagnosisCodes;
    }
}
