package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;

/**
 * Store of paid pharmacy claims consulted during adjudication.
 */
public interface ClaimHistory {

    /** Paid claim for the same pharmacy, Rx number, fill number and date of service. */
    Optional<PharmacyClaimRecord> findPaid(String pharmacyNpi, String rxNumber, int fillNumber, LocalDate serviceDate);

    /** Paid, non-reversed claims for the member ordered by date of service. */
    List<PharmacyClaimRecord> paidClaims(String memberId);

    PharmacyClaimRecord save(PharmacyClaimRecord record);

    /** @return false when no paid claim carries the authorization number */
    boolean markReversed(String authorizationNumber);

    long count();

    /** Highest 9 digit sequence among stored authorization numbers, 0 when none are stored. */
    long lastAuthorizationSequence();

    /** Short label for health reporting. */
    String storeType();
}
