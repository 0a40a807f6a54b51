package com.solusoft.ai.healthsim.features.members.model;

import java.time.LocalDate;
import java.util.List;

public record ServiceReviewDecision(
    String reviewId,
    ServiceReviewRequest request,
    ReviewAction action,
    boolean reviewRequired,
    String certificationNumber, // null unless certified
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    String reasonCode,
    String message,
    List<String> acceptedDiagnosisPrefixes
) {}
