package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;
import com.solusoft.ai.healthsim.features.pharmacy.repository.PharmacyClaimRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Claim history persisted to the {@code pharmacy_claims} table.
 */
@Slf4j
public class JdbcClaimHistory implements ClaimHistory {

    private final PharmacyClaimRepository repository;

    public JdbcClaimHistory(PharmacyClaimRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<PharmacyClaimRecord> findPaid(String pharmacyNpi, String rxNumber, int fillNumber,
            LocalDate serviceDate) {
        return repository.findPaid(pharmacyNpi, rxNumber, fillNumber, serviceDate.toString());
    }

    @Override
    public List<PharmacyClaimRecord> paidClaims(String memberId) {
        return repository.findPaidByMember(memberId);
    }

    @Override
    public PharmacyClaimRecord save(PharmacyClaimRecord record) {
        PharmacyClaimRecord saved = repository.save(record);
        log.debug("Stored pharmacy claim {} as row {}", saved.authorizationNumber(), saved.id());
        return saved;
    }

    @Override
    public boolean markReversed(String authorizationNumber) {
        return repository.markReversed(authorizationNumber) > 0;
    }

    @Override
    public long count() {
        return repository.count();
    }

    @Override
    public long lastAuthorizationSequence() {
        return repository.maxAuthorizationSequence();
    }

    @Override
    public String storeType() {
        return "jdbc";
    }
}
