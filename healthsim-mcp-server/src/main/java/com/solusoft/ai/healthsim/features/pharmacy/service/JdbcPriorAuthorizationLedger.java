package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.util.List;
import java.util.Optional;

import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthorization;
import com.solusoft.ai.healthsim.features.pharmacy.repository.PriorAuthorizationRepository;

public class JdbcPriorAuthorizationLedger implements PriorAuthorizationLedger {

    private final PriorAuthorizationRepository repository;

    public JdbcPriorAuthorizationLedger(PriorAuthorizationRepository repository) {
        this.repository = repository;
    }

    @Override
    public PriorAuthorization save(PriorAuthorization authorization) {
        return repository.save(authorization);
    }

    @Override
    public Optional<PriorAuthorization> findByPaNumber(String paNumber) {
        return repository.findByPaNumber(paNumber);
    }

    @Override
    public List<PriorAuthorization> findApproved(String memberId) {
        return repository.findApprovedByMember(memberId);
    }

    @Override
    public long lastSequence() {
        return repository.maxPaSequence();
    }
}
