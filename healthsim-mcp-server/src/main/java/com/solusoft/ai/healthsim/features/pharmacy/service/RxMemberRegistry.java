package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;

import lombok.extern.slf4j.Slf4j;

/**
 * Pharmacy members generated in this server session, so later claims update the same accumulators.
 * <p>
 * Holds at most {@code capacity} members and drops the least recently used one beyond that.
 * Registering an id that is already held returns the held member. A member registered fresh
 * (new session, or evicted earlier) has the claims already paid under its id added back onto
 * its accumulators, so reversing one of them lands on the same totals.
 */
@Slf4j
public class RxMemberRegistry {

    public static final int DEFAULT_CAPACITY = 10_000;

    private final ClaimHistory claimHistory;
    private final Map<String, RxMember> members;

    public RxMemberRegistry() {
        this(new InMemoryClaimHistory(), DEFAULT_CAPACITY);
    }

    public RxMemberRegistry(ClaimHistory claimHistory, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Registry capacity must be positive: " + capacity);
        }
        this.claimHistory = claimHistory;
        this.members = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RxMember> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized RxMember register(RxMember member) {
        RxMember held = members.get(member.getMemberId());
        if (held != null) {
            log.debug("Member {} already registered, keeping its accumulators", member.getMemberId());
            return held;
        }
        applyPaidClaims(member);
        members.put(member.getMemberId(), member);
        return member;
    }

    public synchronized RxMember get(String memberId) {
        RxMember member = memberId == null ? null : members.get(memberId.trim());
        if (member == null) {
            throw new UnknownReferenceException("rx member", memberId);
        }
        return member;
    }

    public synchronized int size() {
        return members.size();
    }

    private void applyPaidClaims(RxMember member) {
        List<PharmacyClaimRecord> paid = claimHistory.paidClaims(member.getMemberId());
        if (paid.isEmpty()) {
            return;
        }
        BigDecimal deductible = sum(paid, PharmacyClaimRecord::deductibleApplied);
        BigDecimal patientPay = sum(paid, PharmacyClaimRecord::patientPay);
        member.setDeductibleMet(member.getDeductibleMet().add(deductible).min(member.getDeductibleLimit()));
        member.setOopMet(member.getOopMet().add(patientPay).min(member.getOopLimit()));
        log.info("Restored {} paid claim(s) onto member {}: deductible +{}, out-of-pocket +{}",
                paid.size(), member.getMemberId(), deductible, patientPay);
    }

    private static BigDecimal sum(List<PharmacyClaimRecord> records, Function<PharmacyClaimRecord, BigDecimal> amount) {
        return records.stream()
                .map(amount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
