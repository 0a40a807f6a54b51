package com.solusoft.ai.healthsim.features.members.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.solusoft.ai.healthsim.common.model.Demographics;

/**
 * A health-plan member. {@code coverageEnd} is set only for termed members.
 * The accumulator map and claim list are mutable and owned by the member.
 */
public record Member(
    String memberId,
    String subscriberId,
    Demographics demographics,
    int age,
    String planCode,
    String groupId,
    MemberStatus status,
    Relationship relationship,
    LocalDate coverageStart,
    LocalDate coverageEnd,
    Map<String, Accumulator> accumulators,
    List<ProfessionalClaim> claims
) {

    @JsonIgnore
    public boolean isSubscriber() {
        return relationship == Relationship.SELF;
    }

    @JsonIgnore
    public boolean isCoveredOn(LocalDate date) {
        return !date.isBefore(coverageStart) && (coverageEnd == null || !date.isAfter(coverageEnd));
    }

    @JsonIgnore
    public Accumulator deductible() {
        return accumulators.get(Accumulator.DEDUCTIBLE);
    }

    @JsonIgnore
    public Accumulator outOfPocket() {
        return accumulators.get(Accumulator.OUT_OF_POCKET);
    }
}
