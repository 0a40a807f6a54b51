package com.solusoft.ai.healthsim.features.members.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.exception.UnknownReferenceException;

public class X12WriterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T09:05:00Z"), ZoneOffset.UTC);

    @Test
    public void testWrite_buildsEnvelopeAroundBody() {
        X12Writer writer = new X12Writer("HEALTHSIM", "RECEIVER", "T", CLOCK);

        String out = writer.write(X12TransactionType.ELIGIBILITY_INQUIRY_270, List.of("BHT*0022*13", "HL*1**20*1"));
        String[] segments = out.split("~\n");

        assertEquals(7, segments.length);
        assertEquals(105, segments[0].length(), "ISA is fixed width");
        assertTrue(segments[0].startsWith("ISA*00*          *00*          *ZZ*HEALTHSIM      *ZZ*RECEIVER       *250601*0905*^*00501*000000001*0*T*:"));
        assertEquals("GS*HS*HEALTHSIM*RECEIVER*20250601*0905*1*X*005010X279A1", segments[1]);
        assertEquals("ST*270*0001*005010X279A1", segments[2]);
        assertEquals("SE*4*0001", segments[5]);
        assertEquals("IEA*1*000000001", segments[6]);
    }

    @Test
    public void testWrite_controlNumbersIncrease() {
        X12Writer writer = new X12Writer("HEALTHSIM", "RECEIVER", "T", CLOCK);

        writer.write(X12TransactionType.ENROLLMENT_834, List.of());
        String second = writer.write(X12TransactionType.ENROLLMENT_834, List.of());

        assertTrue(second.contains("ST*834*0002*005010X220A1"));
        assertTrue(second.contains("IEA*1*000000002"));
    }

    @Test
    public void testSegment_dropsTrailingEmptiesAndCleansDelimiters() {
        assertEquals("NM1*IL*1*DOE", X12Writer.segment("NM1", "IL", "1", "DOE", "", null));
        assertEquals("N3*12 MAIN ST", X12Writer.segment("N3", "12*MAIN~ST"));
        assertEquals("REF**X", X12Writer.segment("REF", null, "X"));
    }

    @Test
    public void testAmount_trimsInsignificantZeros() {
        assertEquals("100", X12Writer.amount(new BigDecimal("100.00")));
        assertEquals("12.5", X12Writer.amount(new BigDecimal("12.50")));
        assertEquals("0.13", X12Writer.amount(new BigDecimal("0.125")));
    }

    @Test
    public void testTransactionType_parse() {
        assertEquals(X12TransactionType.PROFESSIONAL_CLAIM_837P, X12TransactionType.parse("837p"));
        assertEquals(X12TransactionType.SERVICES_REVIEW_278, X12TransactionType.parse(" 278 "));
        assertThrows(UnknownReferenceException.class, () -> X12TransactionType.parse("999"));
    }
}
