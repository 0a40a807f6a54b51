package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.time.LocalDate;
import java.util.List;

import lombok.Builder;

@Builder
public record PriorAuthDecision(
    String requestId,
    String memberId,
    String ndc,
    String drugName,
    PaCriteriaGroup criteriaGroup,
    PriorAuthStatus status,
    String paNumber,          // approved only
    LocalDate effectiveDate,
    LocalDate expirationDate,
    List<String> metCriteria,
    List<String> unmetCriteria,
    List<String> missingInformation,
    List<String> exclusions,
    String message
) {}
