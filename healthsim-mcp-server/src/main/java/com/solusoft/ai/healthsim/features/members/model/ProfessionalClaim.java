package com.solusoft.ai.healthsim.features.members.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.solusoft.ai.healthsim.common.model.Demographics;

/**
 * A professional (837P) claim with its adjudication outcome. Totals are the sums of the lines.
 */
public record ProfessionalClaim(
    String claimId,
    String memberId,
    String subscriberId,
    String groupId,
    Demographics patient,
    Relationship relationship,
    Provider provider,
    LocalDate serviceDate,
    List<String> diagnosisCodes,
    List<ClaimLine> lines,
    ClaimStatus status,
    BigDecimal totalCharge,
    BigDecimal totalAllowed,
    BigDecimal totalPaid,
    BigDecimal patientResponsibility,
    BigDecimal deductibleApplied,
    BigDecimal copayApplied,
    BigDecimal coinsuranceApplied,
    String denialReasonCode
) {}
