package com.solusoft.ai.healthsim.features.pharmacy.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.common.model.Address;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimResponse;
import com.solusoft.ai.healthsim.features.pharmacy.model.ClaimStatusCode;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlert;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlertType;
import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaim;
import com.solusoft.ai.healthsim.features.pharmacy.model.Reject;
import com.solusoft.ai.healthsim.features.pharmacy.model.RejectCode;
import com.solusoft.ai.healthsim.features.pharmacy.model.RxMember;
import com.solusoft.ai.healthsim.features.pharmacy.model.TransactionCode;

public class NcpdpTelecomFormatterTest {

    private static final String FS = String.valueOf(NcpdpTelecomFormatter.FIELD_SEPARATOR);

    private final NcpdpTelecomFormatter formatter = new NcpdpTelecomFormatter();

    private final RxMember member = RxMember.builder()
            .memberId("RXM000321")
            .cardholderId("00032177")
            .personCode("01")
            .groupNumber("GRP1001")
            .demographics(new Demographics("Ana", null, "Ruiz", LocalDate.of(1981, 7, 4), Gender.F,
                    new Address("9 Elm St", "Austin", "TX", "73301"), null))
            .build();

    private PharmacyClaim.PharmacyClaimBuilder claim() {
        return PharmacyClaim.builder()
                .claimId("CLM1")
                .transactionCode(TransactionCode.B1)
                .serviceDate(LocalDate.of(2025, 3, 10))
                .pharmacyNpi("1234567893")
                .cardholderId("00032177")
                .personCode("01")
                .bin("610014")
                .pcn("RXSIM")
                .groupNumber("GRP1001")
                .prescriptionNumber("RX7001")
                .fillNumber(0)
                .ndc("00093017101")
                .quantityDispensed(new BigDecimal("60"))
                .daysSupply(30)
                .prescriberNpi("1003000126")
                .ingredientCostSubmitted(new BigDecimal("15.00"))
                .dispensingFeeSubmitted(new BigDecimal("2.00"));
    }

    @Test
    public void testOverpunch() {
        assertEquals("80{", NcpdpTelecomFormatter.overpunch(new BigDecimal("8.00")));
        assertEquals("12N", NcpdpTelecomFormatter.overpunch(new BigDecimal("-1.25")));
        assertEquals("1234E", NcpdpTelecomFormatter.overpunch(new BigDecimal("123.45")));
        assertEquals("{", NcpdpTelecomFormatter.overpunch(BigDecimal.ZERO));
        assertNull(NcpdpTelecomFormatter.overpunch(null));
    }

    @Test
    public void testQuantityHasThreeImpliedDecimals() {
        assertEquals("60000", NcpdpTelecomFormatter.quantity(new BigDecimal("60")));
        assertEquals("2500", NcpdpTelecomFormatter.quantity(new BigDecimal("2.5")));
    }

    @Test
    public void testRequestHeaderIsFixedWidth() {
        String header = formatter.requestHeader(claim().build(), TransactionCode.B1);

        assertEquals(NcpdpTelecomFormatter.REQUEST_HEADER_LENGTH, header.length());
        assertEquals("610014D0B1RXSIM     101123456789",
                header.substring(0, 32));
        assertTrue(header.contains("20250310HEALTHSIM1"));
    }

    @Test
    public void testBillingRequestSegments() {
        String request = formatter.request(claim().durOverrideCode("1G").build(), member);

        assertTrue(request.startsWith("610014D0B1"));
        assertTrue(request.contains(FS + "AM04" + FS + "C200032177" + FS + "C1GRP1001"));
        assertTrue(request.contains(FS + "AM01" + FS + "C419810704" + FS + "C52" + FS + "CAAna"));
        assertTrue(request.contains(FS + "D700093017101" + FS + "E760000"));
        assertTrue(request.contains(FS + "AM03" + FS + "EZ01" + FS + "DB1003000126"));
        assertTrue(request.contains(FS + "AM08"));
        assertTrue(request.contains(FS + "E61G"));
        assertTrue(request.contains(FS + "D9150{" + FS + "DC20{"));
        assertFalse(request.contains(FS + "EV"));
        assertEquals(1, request.chars().filter(c -> c == NcpdpTelecomFormatter.GROUP_SEPARATOR).count());
    }

    @Test
    public void testReversalRequestOmitsPricingAndPatient() {
        String request = formatter.request(claim().transactionCode(TransactionCode.B2).build(), member);

        assertTrue(request.startsWith("610014D0B2"));
        assertFalse(request.contains("AM01"));
        assertFalse(request.contains("AM11"));
        assertFalse(request.contains(FS + "E7"));
    }

    @Test
    public void testPaidResponse() {
        ClaimResponse response = ClaimResponse.builder()
                .transactionCode(TransactionCode.B1)
                .status(ClaimStatusCode.P)
                .authorizationNumber("RX20250310000000001")
                .patientPay(new BigDecimal("10.00"))
                .planPaid(new BigDecimal("7.00"))
                .copay(new BigDecimal("10.00"))
                .durAlerts(List.of(new DurAlert(DurAlertType.ER, 3,
                        "Early refill: 20 day(s) of supply remaining from fill on 2025-02-18", "Metformin")))
                .message("Claim paid with DUR warnings")
                .build();

        String out = formatter.response(response, claim().build());

        assertEquals("D0B11A011234567893     20250310", out.substring(0, NcpdpTelecomFormatter.RESPONSE_HEADER_LENGTH));
        assertTrue(out.contains(FS + "AM21" + FS + "ANP" + FS + "F3RX20250310000000001"));
        assertTrue(out.contains(FS + "AM23" + FS + "F5100{"));
        assertTrue(out.contains(FS + "F970{"));
        assertTrue(out.contains(FS + "AM24" + FS + "J61" + FS + "E4ER" + FS + "FS3"));
        assertTrue(out.contains(FS + "FYEarly refill: 20 day(s) of sup"));
    }

    @Test
    public void testRejectedResponseListsRejectCodes() {
        ClaimResponse response = ClaimResponse.builder()
                .transactionCode(TransactionCode.B1)
                .status(ClaimStatusCode.R)
                .rejects(List.of(Reject.of(RejectCode.MISSING_INVALID_GROUP), Reject.of(RejectCode.PATIENT_NOT_COVERED)))
                .message("M/I Group ID")
                .build();

        String out = formatter.response(response, claim().build());

        assertTrue(out.contains(FS + "ANR" + FS + "FA2" + FS + "FB06" + FS + "FB65"));
        assertFalse(out.contains("AM23"));
        assertTrue(out.contains(FS + "AM20" + FS + "F4M/I Group ID"));
    }
}
