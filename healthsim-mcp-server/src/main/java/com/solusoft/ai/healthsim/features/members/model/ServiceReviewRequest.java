package com.solusoft.ai.healthsim.features.members.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A request for utilization review of a planned service (the content of a 278 request).
 */
public record ServiceReviewRequest(
    Member member,
    String providerNpi,
    String cptCode,
    List<String> diagnosisCodes,
    LocalDate serviceDate,
    int units
) {}
