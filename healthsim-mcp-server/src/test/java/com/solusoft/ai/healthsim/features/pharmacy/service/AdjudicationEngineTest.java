package com.solusoft.ai.healthsim.features.pharmacy.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.common.model.Address;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimResponse;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimStatusCode;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlertType;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaim;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthDecision;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.PriorAuthStatus;
import com.solusoft.ai.healthsim.features.pharmacy.model.Reject;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;
import com.solusoft.ai.healthsim.features.pharmacy.model.TransactionCode;

public class AdjudicationEngineTest {

    private static final LocalDate SERVICE_DATE = LocalDate.of(2025, 3, 10);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T15:00:00Z"), ZoneOffset.UTC);

    private static final String METFORMIN = "00093017101";
    private static final String WARFARIN = "00056017270";
    private static final String IBUPROFEN = "00904515260";
    private static final String ELIQUIS = "00003089421";
    private static final String JARDIANCE = "00597015230";
    private static final String TRAMADOL = "00093005801";
    private static final String WEGOVY = "61958060101";
    private static final String LATISSE = "00023361605";
    private static final String HUMIRA = "00074433902";

    private Formulary formulary;
    private InMemoryPriorAuthorizationLedger ledger;
    private AdjudicationEngine engine;
    private RxMember member;
    private int rxSequence;

    @BeforeEach
    public void setUp() {
        formulary = new FormularyGenerator().generateStandardCommercial();
        ledger = new InMemoryPriorAuthorizationLedger();
        engine = new AdjudicationEngine(formulary, new DurValidator(formulary), new InMemoryClaimHistory(), ledger,
                new AdjudicationSettings(75, 2, CLOCK));
        member = RxMember.builder()
                .memberId("RXM000123")
                .cardholderId("00012345")
                .personCode("01")
                .bin("610014")
                .pcn("RXSIM")
                .groupNumber("GRP1001")
                .demographics(new Demographics("Pat", null, "Lee", LocalDate.of(1970, 5, 1), Gender.M,
                        new Address("1 Main St", "Springfield", "IL", "62701"), "2175550100"))
                .age(54)
                .deductibleMet(BigDecimal.ZERO)
                .deductibleLimit(new BigDecimal("250.00"))
                .oopMet(BigDecimal.ZERO)
                .oopLimit(new BigDecimal("3000.00"))
                .effectiveDate(LocalDate.of(2025, 1, 1))
                .terminationDate(LocalDate.of(2025, 12, 31))
                .build();
    }

    private PharmacyClaim.PharmacyClaimBuilder claim(String ndc, String quantity, int days, String ingredientCost) {
        rxSequence++;
        return PharmacyClaim.builder()
                .claimId("CLM" + rxSequence)
                .transactionCode(TransactionCode.B1)
                .serviceDate(SERVICE_DATE)
                .pharmacyNpi("1234567893")
                .memberId(member.getMemberId())
                .cardholderId(member.getCardholderId())
                .personCode("01")
                .bin(member.getBin())
                .pcn(member.getPcn())
                .groupNumber(member.getGroupNumber())
                .prescriptionNumber("RX" + (7000 + rxSequence))
                .fillNumber(0)
                .ndc(ndc)
                .quantityDispensed(new BigDecimal(quantity))
                .daysSupply(days)
                .dawCode("0")
                .prescriberNpi("1003000126")
                .ingredientCostSubmitted(new BigDecimal(ingredientCost))
                .dispensingFeeSubmitted(new BigDecimal("2.00"));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    public void testGenericPaysCopay() {
        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .usualCustomaryCharge(new BigDecimal("30.00")).build(), member);

        assertEquals(ClaimStatusCode.P, response.status());
        assertEquals(1, response.tier());
        assertAmount("17.00", response.allowedAmount());
        assertAmount("10.00", response.patientPay());
        assertAmount("7.00", response.planPaid());
        assertAmount("0", response.deductibleApplied());
        assertTrue(response.authorizationNumber().matches("RX20250310\\d{9}"));
        assertAmount("10.00", member.getOopMet());
        assertEquals("Claim paid", response.message());
    }

    @Test
    public void testAllowedIsLowestOfSubmittedAmounts() {
        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .usualCustomaryCharge(new BigDecimal("8.00")).build(), member);

        assertAmount("8.00", response.allowedAmount());
        assertAmount("8.00", response.patientPay());
        assertAmount("0", response.planPaid());
    }

    @Test
    public void testBrandAppliesDeductibleThenCopay() {
        ClaimResponse response = engine.adjudicate(claim(ELIQUIS, "60", 30, "500.00").build(), member);

        assertEquals(ClaimStatusCode.P, response.status());
        assertAmount("250.00", response.deductibleApplied());
        assertAmount("40.00", response.copay());
        assertAmount("290.00", response.patientPay());
        assertAmount("212.00", response.planPaid());
        assertAmount("0", response.remainingDeductible());
        assertAmount("2710.00", response.remainingOop());
    }

    @Test
    public void testOutOfPocketCapLimitsPatientPay() {
        member.setDeductibleMet(new BigDecimal("250.00"));
        member.setOopMet(new BigDecimal("2980.00"));

        ClaimResponse response = engine.adjudicate(claim(ELIQUIS, "60", 30, "500.00").build(), member);

        assertAmount("20.00", response.patientPay());
        assertAmount("482.00", response.planPaid());
        assertAmount("0", response.remainingOop());
    }

    @Test
    public void testCardholderMismatchRejects52() {
        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .cardholderId("99999999").groupNumber("WRONG").build(), member);

        assertEquals(ClaimStatusCode.R, response.status());
        assertEquals(List.of("52"), response.rejects().stream().map(Reject::code).toList());
        assertAmount("0", response.planPaid());
        assertAmount("0", response.patientPay());
    }

    @Test
    public void testEligibilityRejectsAreCollected() {
        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "0", 120, "15.00")
                .groupNumber("OTHER").serviceDate(LocalDate.of(2026, 2, 1)).build(), member);

        assertEquals(List.of("06", "65", "E7", "19"), response.rejects().stream().map(Reject::code).toList());
        assertEquals("M/I Group ID", response.message());
    }

    @Test
    public void testMissingPharmacyAndRxNumberReject() {
        InMemoryClaimHistory history = new InMemoryClaimHistory();
        engine = new AdjudicationEngine(formulary, new DurValidator(formulary), history, ledger,
                new AdjudicationSettings(75, 2, CLOCK));

        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .pharmacyNpi(null).prescriptionNumber(" ").build(), member);

        assertEquals(List.of("05", "16"), response.rejects().stream().map(Reject::code).toList());
        assertEquals(0, history.count());
        assertAmount("0", member.getOopMet());

        ClaimResponse next = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00").build(), member);
        assertEquals(ClaimStatusCode.P, next.status());
    }

    @Test
    public void testReversalWithoutPharmacyRejects87() {
        PharmacyClaim original = claim(METFORMIN, "60", 30, "15.00").build();
        engine.adjudicate(original, member);

        ClaimResponse response = engine.reverse(original.toBuilder().pharmacyNpi(null).build(), member);

        assertEquals("87", response.rejectCode());
        assertAmount("10.00", member.getOopMet());
    }

    @Test
    public void testFailedSaveLeavesAccumulatorsUntouched() {
        ClaimHistory failing = mock(ClaimHistory.class);
        when(failing.save(any())).thenThrow(new IllegalStateException("disk full"));
        engine = new AdjudicationEngine(formulary, new DurValidator(formulary), failing, ledger,
                new AdjudicationSettings(75, 2, CLOCK));

        assertThrows(IllegalStateException.class,
                () -> engine.adjudicate(claim(ELIQUIS, "60", 30, "500.00").build(), member));

        assertAmount("0", member.getDeductibleMet());
        assertAmount("0", member.getOopMet());
    }

    @Test
    public void testAuthorizationNumbersContinueFromHistory() {
        InMemoryClaimHistory history = new InMemoryClaimHistory();
        history.save(PharmacyClaimRecord.builder()
                .authorizationNumber("RX20250309000000041")
                .memberId("RXM000999")
                .pharmacyNpi("1234567893")
                .rxNumber("RX1")
                .ndc(METFORMIN)
                .serviceDate(SERVICE_DATE.minusDays(1))
                .status(PharmacyClaimRecord.PAID)
                .build());
        engine = new AdjudicationEngine(formulary, new DurValidator(formulary), history, ledger,
                new AdjudicationSettings(75, 2, CLOCK));

        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00").build(), member);

        assertEquals("RX20250310000000042", response.authorizationNumber());
    }

    @Test
    public void testExcludedDrugRejects70() {
        ClaimResponse response = engine.adjudicate(claim(LATISSE, "1", 30, "120.00").build(), member);

        assertEquals("70", response.rejectCode());
        assertEquals("Product/Service Not Covered: NDC " + LATISSE, response.rejectMessage());
    }

    @Test
    public void testUnknownNdcRejects70() {
        assertEquals("70", engine.adjudicate(claim("11111111111", "1", 30, "5.00").build(), member).rejectCode());
    }

    @Test
    public void testPaDrugWithoutAuthorizationRejects75() {
        ClaimResponse response = engine.adjudicate(claim(WEGOVY, "3", 28, "1300.00").build(), member);

        assertEquals("75", response.rejectCode());
    }

    @Test
    public void testApprovedPriorAuthorizationLetsClaimPay() {
        PriorAuthorizationService paService = new PriorAuthorizationService(formulary, ledger, CLOCK);
        PriorAuthDecision decision = paService.evaluate(PriorAuthRequest.builder()
                .memberId(member.getMemberId())
                .ndc(HUMIRA)
                .diagnosisCodes(List.of("M06.9"))
                .failedConventionalTherapy(true)
                .specialistConfirmed(true)
                .build());
        assertEquals(PriorAuthStatus.APPROVED, decision.status());

        ClaimResponse response = engine.adjudicate(claim(HUMIRA, "2", 28, "6000.00")
                .priorAuthNumber(decision.paNumber()).build(), member);

        assertEquals(ClaimStatusCode.P, response.status());
        assertEquals(5, response.tier());
        assertAmount("250.00", response.deductibleApplied());
        assertAmount("1438.00", response.coinsurance());
        assertAmount("1688.00", response.patientPay());
        assertAmount("4314.00", response.planPaid());
    }

    @Test
    public void testPriorAuthorizationForAnotherMemberDoesNotApply() {
        PriorAuthorizationService paService = new PriorAuthorizationService(formulary, ledger, CLOCK);
        PriorAuthDecision decision = paService.evaluate(PriorAuthRequest.builder()
                .memberId("RXM999999")
                .ndc(HUMIRA)
                .diagnosisCodes(List.of("L40.0"))
                .failedConventionalTherapy(true)
                .specialistConfirmed(true)
                .build());

        ClaimResponse response = engine.adjudicate(claim(HUMIRA, "2", 28, "6000.00")
                .priorAuthNumber(decision.paNumber()).build(), member);

        assertEquals("75", response.rejectCode());
    }

    @Test
    public void testStepTherapyRejectsWithoutPrerequisite() {
        ClaimResponse response = engine.adjudicate(claim(JARDIANCE, "30", 30, "550.00").build(), member);

        assertEquals("608", response.rejectCode());
        assertTrue(response.rejectMessage().endsWith("requires prior fill of GPI class 2725"));
    }

    @Test
    public void testStepTherapyMetByEarlierMetforminFill() {
        engine.adjudicate(claim(METFORMIN, "60", 30, "15.00").serviceDate(SERVICE_DATE.minusDays(60)).build(), member);

        ClaimResponse response = engine.adjudicate(claim(JARDIANCE, "30", 30, "550.00").build(), member);

        assertEquals(ClaimStatusCode.P, response.status());
        assertEquals(3, response.tier());
    }

    @Test
    public void testQuantityLimitRejects76() {
        ClaimResponse response = engine.adjudicate(claim(TRAMADOL, "300", 30, "20.00").build(), member);

        assertEquals("76", response.rejectCode());
        assertTrue(response.rejectMessage().contains("240 per 30 days"));
    }

    @Test
    public void testRefillTooSoonRejects79() {
        engine.adjudicate(claim(METFORMIN, "60", 30, "15.00").build(), member);

        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .serviceDate(SERVICE_DATE.plusDays(10)).build(), member);

        assertEquals("79", response.rejectCode());
        assertEquals(SERVICE_DATE.plusDays(23), response.nextFillDate());
    }

    @Test
    public void testRefillAfterThresholdPays() {
        engine.adjudicate(claim(METFORMIN, "60", 30, "15.00").build(), member);

        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .serviceDate(SERVICE_DATE.plusDays(23)).build(), member);

        assertEquals(ClaimStatusCode.P, response.status());
    }

    @Test
    public void testSeriousInteractionRejects88() {
        engine.adjudicate(claim(WARFARIN, "30", 30, "12.00").serviceDate(SERVICE_DATE.minusDays(9)).build(), member);

        ClaimResponse response = engine.adjudicate(claim(IBUPROFEN, "60", 30, "9.00").build(), member);

        assertEquals("88", response.rejectCode());
        assertEquals("DUR Reject Error: Drug-Drug Interaction", response.rejectMessage());
        assertEquals(DurAlertType.DD, response.durAlerts().get(0).alertType());
    }

    @Test
    public void testDurOverridePaysWithWarnings() {
        engine.adjudicate(claim(WARFARIN, "30", 30, "12.00").serviceDate(SERVICE_DATE.minusDays(9)).build(), member);

        ClaimResponse response = engine.adjudicate(claim(IBUPROFEN, "60", 30, "9.00")
                .durOverrideCode("1G").build(), member);

        assertEquals(ClaimStatusCode.P, response.status());
        assertEquals(1, response.durAlerts().size());
        assertEquals("Claim paid with DUR warnings", response.message());
    }

    @Test
    public void testResubmissionIsDuplicate() {
        PharmacyClaim original = claim(METFORMIN, "60", 30, "15.00").build();
        ClaimResponse paid = engine.adjudicate(original, member);

        ClaimResponse duplicate = engine.adjudicate(original, member);

        assertEquals(ClaimStatusCode.D, duplicate.status());
        assertEquals(paid.authorizationNumber(), duplicate.authorizationNumber());
        assertAmount("10.00", member.getOopMet());
    }

    @Test
    public void testReversalRestoresAccumulators() {
        PharmacyClaim original = claim(ELIQUIS, "60", 30, "500.00").build();
        ClaimResponse paid = engine.adjudicate(original, member);
        assertAmount("250.00", member.getDeductibleMet());

        ClaimResponse reversal = engine.adjudicate(original.toBuilder().transactionCode(TransactionCode.B2).build(),
                member);

        assertEquals(ClaimStatusCode.A, reversal.status());
        assertEquals(paid.authorizationNumber(), reversal.authorizationNumber());
        assertAmount("0", member.getDeductibleMet());
        assertAmount("0", member.getOopMet());

        ClaimResponse again = engine.reverse(original, member);
        assertEquals("87", again.rejectCode());
    }

    @Test
    public void testReversalWithoutPaidClaimRejects87() {
        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .transactionCode(TransactionCode.B2).build(), member);

        assertEquals(ClaimStatusCode.R, response.status());
        assertEquals("87", response.rejectCode());
        assertEquals("Reversal Not Processed: no matching paid claim", response.rejectMessage());
    }

    @Test
    public void testRebillReversesThenBills() {
        PharmacyClaim original = claim(METFORMIN, "60", 30, "15.00").build();
        ClaimResponse paid = engine.adjudicate(original, member);

        ClaimResponse rebill = engine.adjudicate(original.toBuilder()
                .transactionCode(TransactionCode.B3)
                .ingredientCostSubmitted(new BigDecimal("5.00"))
                .build(), member);

        assertEquals(TransactionCode.B3, rebill.transactionCode());
        assertEquals(ClaimStatusCode.P, rebill.status());
        assertNotEquals(paid.authorizationNumber(), rebill.authorizationNumber());
        assertAmount("7.00", rebill.allowedAmount());
        assertAmount("7.00", member.getOopMet());
        assertEquals(2, engine.claimHistory().count());
        assertEquals(1, engine.claimHistory().paidClaims(member.getMemberId()).size());
    }

    @Test
    public void testRebillWithoutOriginalKeepsB3() {
        ClaimResponse response = engine.adjudicate(claim(METFORMIN, "60", 30, "15.00")
                .transactionCode(TransactionCode.B3).build(), member);

        assertEquals(TransactionCode.B3, response.transactionCode());
        assertEquals("87", response.rejectCode());
    }

    @Test
    public void testMissingMemberIsInvalid() {
        assertThrows(InvalidRequestException.class,
                () -> engine.adjudicate(claim(METFORMIN, "60", 30, "15.00").build(), null));
    }
}
