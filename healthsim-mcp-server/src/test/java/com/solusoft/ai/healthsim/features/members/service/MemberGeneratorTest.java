package com.solusoft.ai.healthsim.features.members.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.members.model.Accumulator;
import com.solusoft.ai.healthsim.features.members.model.ClaimStatus;
import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.model.MemberConstraints;
import com.solusoft.ai.healthsim.features.members.model.MemberStatus;
import com.solusoft.ai.healthsim.features.members.model.ProfessionalClaim;
import com.solusoft.ai.healthsim.features.members.model.Relationship;

public class MemberGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    @Test
    public void testSameSeed_reproducesMembers() {
        List<Member> a = new MemberGenerator(42L, CLOCK).generateMemberBatch(5);
        List<Member> b = new MemberGenerator(42L, CLOCK).generateMemberBatch(5);

        for (int i = 0; i < 5; i++) {
            assertEquals(a.get(i).memberId(), b.get(i).memberId());
            assertEquals(a.get(i).demographics(), b.get(i).demographics());
            assertEquals(a.get(i).deductible().getUsed(), b.get(i).deductible().getUsed());
        }
    }

    @Test
    public void testAccumulators_withinLimits() {
        for (Member member : new MemberGenerator(3L, CLOCK).generateMemberBatch(50)) {
            Accumulator deductible = member.deductible();
            Accumulator oop = member.outOfPocket();
            assertTrue(deductible.getUsed().compareTo(deductible.getLimit()) <= 0);
            assertTrue(oop.getUsed().compareTo(oop.getLimit()) <= 0);
            assertTrue(oop.getUsed().compareTo(deductible.getUsed()) >= 0);
        }
    }

    @Test
    public void testTermedMember_hasCoverageEndAfterStart() {
        Member member = new MemberGenerator(8L, CLOCK).generateMember(
                new MemberConstraints("PPO-SILVER", null, MemberStatus.TERMED, null));

        assertEquals("PPO-SILVER", member.planCode());
        assertTrue(member.coverageEnd() != null && member.coverageEnd().isAfter(member.coverageStart()));
    }

    @Test
    public void testActiveMember_isCoveredToday() {
        Member member = new MemberGenerator(8L, CLOCK).generateMember(
                new MemberConstraints(null, null, MemberStatus.ACTIVE, null));

        assertNull(member.coverageEnd());
        assertTrue(member.isCoveredOn(TODAY));
        assertEquals(1, member.coverageStart().getDayOfMonth());
    }

    @Test
    public void testFamily_sharesSubscriberAndName() {
        List<Member> family = new MemberGenerator(12L, CLOCK).generateFamily("HMO-STANDARD", true, 2);

        assertEquals(4, family.size());
        Member subscriber = family.get(0);
        assertTrue(subscriber.isSubscriber());
        assertEquals(Relationship.SPOUSE, family.get(1).relationship());
        assertEquals(Relationship.CHILD, family.get(3).relationship());
        for (Member member : family) {
            assertEquals(subscriber.subscriberId(), member.subscriberId());
            assertEquals(subscriber.groupId(), member.groupId());
            assertEquals(subscriber.demographics().lastName(), member.demographics().lastName());
        }
        assertEquals(4, family.stream().map(Member::memberId).distinct().count());
    }

    @Test
    public void testClaims_orderedAndBalanced() {
        LocalDate start = LocalDate.of(2025, 1, 1);
        Member member = new MemberGenerator(21L, CLOCK).generateMemberWithClaims("PPO-GOLD", 12, start, TODAY);

        List<ProfessionalClaim> claims = member.claims();
        assertEquals(12, claims.size());
        for (int i = 0; i < claims.size(); i++) {
            ProfessionalClaim claim = claims.get(i);
            assertTrue(!claim.serviceDate().isBefore(start) && !claim.serviceDate().isAfter(TODAY));
            if (i > 0) {
                assertTrue(!claim.serviceDate().isBefore(claims.get(i - 1).serviceDate()));
            }
            if (claim.status() == ClaimStatus.PAID) {
                assertEquals(0, claim.totalAllowed().compareTo(claim.totalPaid().add(claim.patientResponsibility())));
            } else {
                assertEquals(0, claim.totalPaid().signum());
            }
        }
    }

    @Test
    public void testClaims_driveAccumulatorsFromZero() {
        Member member = new MemberGenerator(21L, CLOCK).generateMemberWithClaims("EPO-BRONZE", 6,
                LocalDate.of(2025, 1, 1), TODAY);

        BigDecimal deductibleApplied = member.claims().stream()
                .map(ProfessionalClaim::deductibleApplied).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, deductibleApplied.compareTo(member.deductible().getUsed()));
    }

    @Test
    public void testInvalidInputs_rejected() {
        MemberGenerator generator = new MemberGenerator(1L, CLOCK);

        assertThrows(UnknownReferenceException.class, () -> generator.generateMember(MemberConstraints.plan("PPO-PLATINUM")));
        assertThrows(InvalidRequestException.class, () -> generator.generateFamily("PPO-GOLD", false, -1));
        assertThrows(InvalidRequestException.class, () -> generator.generatePopulation(5, true, 3, 1));
        assertThrows(InvalidRequestException.class,
                () -> generator.generateMemberWithClaims("PPO-GOLD", 1, TODAY, TODAY.minusDays(1)));
    }
}
