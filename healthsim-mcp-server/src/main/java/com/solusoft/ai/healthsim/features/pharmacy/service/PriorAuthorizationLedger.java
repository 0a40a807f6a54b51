package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthorization;

/**
 * Prior authorizations on file, consulted when a claim quotes a PA number or needs a step therapy override.
 */
public interface PriorAuthorizationLedger {

    PriorAuthorization save(PriorAuthorization authorization);

    Optional<PriorAuthorization> findByPaNumber(String paNumber);

    List<PriorAuthorization> findApproved(String memberId);

    /** Highest 9 digit sequence among stored PA numbers, 0 when none are stored. */
    long lastSequence();

    default boolean isValid(String paNumber, String memberId, FormularyDrug drug, LocalDate serviceDate) {
        if (paNumber == null || paNumber.isBlank()) {
            return false;
        }
        return findByPaNumber(paNumber.trim())
                .map(pa -> pa.covers(memberId, drug.ndc(), drug.gpi(), serviceDate))
                .orElse(false);
    }

    default boolean hasActive(String memberId, FormularyDrug drug, LocalDate serviceDate) {
        return findApproved(memberId).stream()
                .anyMatch(pa -> pa.covers(memberId, drug.ndc(), drug.gpi(), serviceDate));
    }
}
