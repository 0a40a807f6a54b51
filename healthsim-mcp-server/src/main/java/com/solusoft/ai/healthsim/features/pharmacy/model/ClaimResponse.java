package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;

/**
 * Adjudication outcome returned to the pharmacy.
 */
@Builder(toBuilder = true)
public record ClaimResponse(
    String claimId,
    TransactionCode transactionCode,
    ClaimStatusCode status,
    String authorizationNumber,
    Integer tier,
    BigDecimal allowedAmount,
    BigDecimal ingredientCostPaid,
    BigDecimal dispensingFeePaid,
    BigDecimal planPaid,
    BigDecimal patientPay,
    BigDecimal copay,
    BigDecimal coinsurance,
    BigDecimal deductibleApplied,
    List<Reject> rejects,
    List<DurAlert> durAlerts,
    BigDecimal remainingDeductible,
    BigDecimal remainingOop,
    LocalDate nextFillDate,
    String message
) {

    public List<Reject> rejects() {
        return rejects == null ? List.of() : rejects;
    }

    public List<DurAlert> durAlerts() {
        return durAlerts == null ? List.of() : durAlerts;
    }

    @JsonIgnore
    public boolean isPaid() {
        return status == ClaimStatusCode.P;
    }

    /** First reject code, or null. */
    @JsonIgnore
    public String rejectCode() {
        return rejects().isEmpty() ? null : rejects().get(0).code();
    }

    @JsonIgnore
    public String rejectMessage() {
        return rejects().isEmpty() ? null : rejects().get(0).message();
    }
}
