package com.solusoft.ai.healthsim.features.members.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.features.members.model.ClaimStatus;
import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.model.MemberConstraints;
import com.solusoft.ai.healthsim.features.members.model.MemberStatus;
import com.solusoft.ai.healthsim.features.members.model.ProfessionalClaim;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewDecision;
import com.solusoft.ai.healthsim.features.members.model.ServiceReviewRequest;
import com.solusoft.ai.healthsim.features.members.service.MemberGenerator;
import com.solusoft.ai.healthsim.features.members.service.ServiceReviewService;

public class X12TransactionFormattersTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String PAYER = "HEALTHSIM HEALTH PLAN";

    private X12Writer writer;
    private MemberGenerator generator;

    @BeforeEach
    public void setup() {
        writer = new X12Writer("HEALTHSIM", "RECEIVER", "T", CLOCK);
        generator = new MemberGenerator(42L, CLOCK);
    }

    private static List<String> segments(String interchange) {
        return Arrays.asList(interchange.split("~\n"));
    }

    /** SE01 must equal the number of segments from ST through SE. */
    private static void assertBalanced(String interchange) {
        List<String> segments = segments(interchange);
        int st = -1;
        int se = -1;
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).startsWith("ST*")) st = i;
            if (segments.get(i).startsWith("SE*")) se = i;
        }
        assertTrue(st >= 0 && se > st);
        assertEquals(String.valueOf(se - st + 1), segments.get(se).split("\\*")[1]);
    }

    private static long count(String interchange, String prefix) {
        return segments(interchange).stream().filter(s -> s.startsWith(prefix)).count();
    }

    @Test
    public void testGenerate834_oneInsLoopPerMember() {
        List<Member> family = generator.generateFamily("PPO-GOLD", true, 1);

        String out = new EnrollmentFormatter(writer, PAYER, "HSPAYER01").generate834(family);

        assertBalanced(out);
        assertEquals(3, count(out, "INS*"));
        assertTrue(out.contains("INS*Y*18"));
        assertTrue(out.contains("INS*N*01"));
        assertTrue(out.contains("INS*N*19"));
        assertTrue(out.contains("HD*021**HLT*PPO-GOLD*IND"));
        assertTrue(out.contains("REF*0F*" + family.get(0).subscriberId()));
    }

    @Test
    public void testGenerate834_termedMemberCarriesEndDates() {
        Member termed = generator.generateMember(new MemberConstraints("PPO-GOLD", null, MemberStatus.TERMED, null));

        String out = new EnrollmentFormatter(writer, PAYER, "HSPAYER01").generate834(List.of(termed));

        assertTrue(out.contains("HD*024"));
        assertTrue(out.contains("DTP*349*D8*" + X12Writer.date(termed.coverageEnd())));
    }

    @Test
    public void testGenerate837p_oneClmPerClaimAndSv1PerLine() {
        Member member = generator.generateMemberWithClaims("PPO-SILVER", 4, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 5, 31));
        List<ProfessionalClaim> claims = member.claims();

        String out = new ProfessionalClaimFormatter(writer, PAYER, "HSPAYER01").generate837p(claims);

        assertBalanced(out);
        assertTrue(out.contains("ST*837*0001*005010X222A1"));
        assertEquals(claims.size(), count(out, "CLM*"));
        assertEquals(claims.stream().mapToLong(c -> c.lines().size()).sum(), count(out, "SV1*HC:"));
        assertTrue(out.contains("CLM*" + claims.get(0).claimId() + "*" + X12Writer.amount(claims.get(0).totalCharge())));
    }

    @Test
    public void testGenerate835_paymentTotalsPaidClaims() {
        Member member = generator.generateMemberWithClaims("PPO-GOLD", 6, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 5, 31));

        String out = new RemittanceFormatter(writer, PAYER, "HSPAYER01").generate835(member.claims());

        assertBalanced(out);
        String bpr = segments(out).stream().filter(s -> s.startsWith("BPR*")).findFirst().orElseThrow();
        assertEquals(X12Writer.amount(member.claims().stream()
                .filter(c -> c.status() == ClaimStatus.PAID)
                .map(ProfessionalClaim::totalPaid)
                .reduce(BigDecimal.ZERO, BigDecimal::add)), bpr.split("\\*")[2]);
        assertTrue(count(out, "CLP*") >= 1);
    }

    @Test
    public void testGenerate270And271_eligibility() {
        Member member = generator.generateMember(new MemberConstraints("HMO-STANDARD", null, MemberStatus.ACTIVE, null));
        EligibilityFormatter formatter = new EligibilityFormatter(writer, PAYER, "HSPAYER01");

        String inquiry = formatter.generate270(member);
        String response = formatter.generate271(member, true);

        assertBalanced(inquiry);
        assertTrue(inquiry.contains("EQ*30"));
        assertBalanced(response);
        assertTrue(response.contains("EB*1*IND*30*HM*HMO Standard"));
        assertTrue(response.contains("EB*C*IND*30***23*" + X12Writer.amount(member.deductible().getLimit())));
        assertTrue(response.contains("EB*C*IND*30***29*" + X12Writer.amount(member.deductible().remaining())));
    }

    @Test
    public void testGenerate278_requestAndResponse() {
        Member member = generator.generateMember(new MemberConstraints("PPO-GOLD", null, MemberStatus.ACTIVE, null));
        ServiceReviewRequest request = new ServiceReviewRequest(member, "1234567893", "73721",
                List.of("M17.11"), LocalDate.of(2025, 6, 15), 1);
        ServiceReviewDecision decision = new ServiceReviewService(CLOCK).review(request);
        ServiceReviewFormatter formatter = new ServiceReviewFormatter(writer, PAYER, "HSPAYER01");

        String requestOut = formatter.generate278Request(request);
        String responseOut = formatter.generate278Response(decision);

        assertBalanced(requestOut);
        assertTrue(requestOut.contains("UM*HS*I*1"));
        assertTrue(requestOut.contains("SV1*HC:73721**UN*1"));
        assertBalanced(responseOut);
        assertTrue(responseOut.contains("HCR*A1*" + decision.certificationNumber()));
        assertTrue(responseOut.contains("REF*BB*" + decision.certificationNumber()));
    }
}
