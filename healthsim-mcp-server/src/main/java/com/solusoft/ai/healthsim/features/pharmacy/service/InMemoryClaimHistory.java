package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;

public class InMemoryClaimHistory implements ClaimHistory {

    private final List<PharmacyClaimRecord> records = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized Optional<PharmacyClaimRecord> findPaid(String pharmacyNpi, String rxNumber, int fillNumber,
            LocalDate serviceDate) {
        return records.stream()
                .filter(PharmacyClaimRecord::isPaid)
                .filter(r -> Objects.equals(r.pharmacyNpi(), pharmacyNpi)
                        && Objects.equals(r.rxNumber(), rxNumber)
                        && r.fillNumber() == fillNumber
                        && r.serviceDate().equals(serviceDate))
                .findFirst();
    }

    @Override
    public synchronized List<PharmacyClaimRecord> paidClaims(String memberId) {
        return records.stream()
                .filter(PharmacyClaimRecord::isPaid)
                .filter(r -> r.memberId().equals(memberId))
                .sorted(Comparator.comparing(PharmacyClaimRecord::serviceDate))
                .toList();
    }

    @Override
    public synchronized PharmacyClaimRecord save(PharmacyClaimRecord record) {
        PharmacyClaimRecord stored = record.id() == null ? record.withId(ids.incrementAndGet()) : record;
        records.removeIf(r -> r.id().equals(stored.id()));
        records.add(stored);
        return stored;
    }

    @Override
    public synchronized boolean markReversed(String authorizationNumber) {
        for (int i = 0; i < records.size(); i++) {
            PharmacyClaimRecord record = records.get(i);
            if (record.isPaid() && record.authorizationNumber().equals(authorizationNumber)) {
                records.set(i, record.toBuilder().status(PharmacyClaimRecord.REVERSED).build());
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized long count() {
        return records.size();
    }

    @Override
    public synchronized long lastAuthorizationSequence() {
        return records.stream()
                .mapToLong(r -> AuthorizationNumbers.sequenceOf(r.authorizationNumber()))
                .max()
                .orElse(0);
    }

    @Override
    public String storeType() {
        return "memory";
    }
}
