package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthStatus;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthorization;

public class InMemoryPriorAuthorizationLedger implements PriorAuthorizationLedger {

    private final Map<String, PriorAuthorization> byNumber = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public PriorAuthorization save(PriorAuthorization authorization) {
        PriorAuthorization stored = authorization.id() == null
                ? authorization.withId(ids.incrementAndGet())
                : authorization;
        byNumber.put(stored.paNumber(), stored);
        return stored;
    }

    @Override
    public Optional<PriorAuthorization> findByPaNumber(String paNumber) {
        return Optional.ofNullable(byNumber.get(paNumber));
    }

    @Override
    public List<PriorAuthorization> findApproved(String memberId) {
        return byNumber.values().stream()
                .filter(pa -> pa.memberId().equals(memberId))
                .filter(pa -> PriorAuthStatus.APPROVED.name().equals(pa.status()))
                .toList();
    }

    @Override
    public long lastSequence() {
        return byNumber.keySet().stream().mapToLong(AuthorizationNumbers::sequenceOf).max().orElse(0);
    }
}
