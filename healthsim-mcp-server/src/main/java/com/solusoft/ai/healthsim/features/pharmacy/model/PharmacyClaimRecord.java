package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Builder;
import lombok.With;

/**
 * A paid (or later reversed) pharmacy claim kept for duplicate, refill-too-soon, step therapy
 * and reversal checks.
 */
@Table("pharmacy_claims")
@Builder(toBuilder = true)
public record PharmacyClaimRecord(
    @Id @With
    Long id, // null until stored

    String authorizationNumber,
    String claimId,
    String memberId,
    String pharmacyNpi,
    String rxNumber,
    int fillNumber,
    String ndc,
    String gpi,
    String drugName,
    LocalDate serviceDate,
    BigDecimal quantity,
    int daysSupply,
    int tier,
    BigDecimal planPaid,
    BigDecimal patientPay,
    BigDecimal deductibleApplied,
    BigDecimal copay,
    BigDecimal coinsurance,
    String status,
    LocalDateTime createdAt
) {

    public static final String PAID = "PAID";
    public static final String REVERSED = "REVERSED";

    public boolean isPaid() {
        return PAID.equals(status);
    }
}
