package com.solusoft.ai.healthsim.features.pharmacy.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.ai.healthsim.features.pharmacy.model.PharmacyClaimRecord;
import com.solusoft.ai.healthsim.features.pharmacy.repository.PharmacyClaimRepository;

public class JdbcClaimHistoryTest {

    @Mock
    private PharmacyClaimRepository repository;

    private JdbcClaimHistory history;

    private final PharmacyClaimRecord record = PharmacyClaimRecord.builder()
            .authorizationNumber("RX20250310000000001")
            .memberId("RXM000123")
            .pharmacyNpi("1234567893")
            .rxNumber("RX7001")
            .fillNumber(0)
            .ndc("00093017101")
            .serviceDate(LocalDate.of(2025, 3, 10))
            .quantity(new BigDecimal("60"))
            .daysSupply(30)
            .tier(1)
            .planPaid(new BigDecimal("7.00"))
            .patientPay(new BigDecimal("10.00"))
            .status(PharmacyClaimRecord.PAID)
            .build();

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        history = new JdbcClaimHistory(repository);
    }

    @Test
    public void testFindPaidQueriesIsoDate() {
        when(repository.findPaid("1234567893", "RX7001", 0, "2025-03-10")).thenReturn(Optional.of(record));

        Optional<PharmacyClaimRecord> found = history.findPaid("1234567893", "RX7001", 0, LocalDate.of(2025, 3, 10));

        assertTrue(found.isPresent());
        assertEquals("RX20250310000000001", found.get().authorizationNumber());
    }

    @Test
    public void testSaveReturnsStoredRow() {
        when(repository.save(record)).thenReturn(record.withId(41L));

        assertEquals(41L, history.save(record).id());
    }

    @Test
    public void testMarkReversed() {
        when(repository.markReversed("RX20250310000000001")).thenReturn(1);
        when(repository.markReversed("RX20250310000000002")).thenReturn(0);

        assertTrue(history.markReversed("RX20250310000000001"));
        assertFalse(history.markReversed("RX20250310000000002"));
    }

    @Test
    public void testPaidClaimsAndCount() {
        when(repository.findPaidByMember("RXM000123")).thenReturn(List.of(record));
        when(repository.count()).thenReturn(5L);

        assertEquals(1, history.paidClaims("RXM000123").size());
        assertEquals(5L, history.count());
        assertEquals("jdbc", history.storeType());
        verify(repository).findPaidByMember("RXM000123");
    }

    @Test
    public void testLastAuthorizationSequenceFromRepository() {
        when(repository.maxAuthorizationSequence()).thenReturn(1200L);

        assertEquals(1200L, history.lastAuthorizationSequence());
    }
}
