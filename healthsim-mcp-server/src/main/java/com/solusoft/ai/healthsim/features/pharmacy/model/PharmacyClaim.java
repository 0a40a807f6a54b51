package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.Builder;

/**
 * An NCPDP pharmacy claim as submitted by the pharmacy.
 */
@Builder(toBuilder = true)
public record PharmacyClaim(
    String claimId,
    TransactionCode transactionCode,
    LocalDate serviceDate,
    String pharmacyNpi,
    String memberId,
    String cardholderId,
    String personCode,
    String bin,
    String pcn,
    String groupNumber,
    String prescriptionNumber,
    int fillNumber,
    String ndc,
    BigDecimal quantityDispensed,
    int daysSupply,
    String dawCode,
    String prescriberNpi,
    BigDecimal ingredientCostSubmitted,
    BigDecimal dispensingFeeSubmitted,
    BigDecimal patientPaidSubmitted,
    BigDecimal usualCustomaryCharge,
    BigDecimal grossAmountDue,
    String priorAuthNumber,  // optional
    String durOverrideCode   // optional, e.g. 1G
) {}
