package com.solusoft.ai.healthsim.features.pharmacy.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.config.HealthSimProperties;
import com.solusoft.ai.healthsim.features.pharmacy.format.NcpdpScriptFormatter;
import com.solusoft.ai.healthsim.features.pharmacy.format.NcpdpTelecomFormatter;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurResult;
import com.solusoft.ai.healthsim.features.pharmacy.service.AdjudicationEngine;
import com.solusoft.ai.healthsim.features.pharmacy.service.AdjudicationSettings;
import com.solusoft.ai.healthsim.features.pharmacy.service.DurValidator;
import com.solusoft.ai.healthsim.features.pharmacy.service.Formulary;
import com.solusoft.ai.healthsim.features.pharmacy.service.FormularyGenerator;
import com.solusoft.ai.healthsim.features.pharmacy.service.InMemoryClaimHistory;
import com.solusoft.ai.healthsim.features.pharmacy.service.InMemoryPriorAuthorizationLedger;
import com.solusoft.ai.healthsim.features.pharmacy.service.PriorAuthorizationService;
import com.solusoft.ai.healthsim.features.pharmacy.service.RxMemberRegistry;

public class PharmacyMcpToolsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private DurValidator durValidator;

    private ObjectMapper objectMapper;

    private RxMemberRegistry registry;

    private PharmacyMcpTools tools;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);

        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());

        Formulary formulary = new FormularyGenerator().generateStandardCommercial();
        InMemoryPriorAuthorizationLedger ledger = new InMemoryPriorAuthorizationLedger();
        AdjudicationEngine engine = new AdjudicationEngine(formulary, new DurValidator(formulary),
                new InMemoryClaimHistory(), ledger, new AdjudicationSettings(75, 2, CLOCK));
        registry = new RxMemberRegistry(engine.claimHistory(), 100);
        tools = new PharmacyMcpTools(objectMapper, new HealthSimProperties(), engine, durValidator,
                new PriorAuthorizationService(formulary, ledger, CLOCK), registry, new NcpdpTelecomFormatter(),
                new NcpdpScriptFormatter("HEALTHSIM", CLOCK), CLOCK);
    }

    private Map<?, ?> read(String json) throws Exception {
        return objectMapper.readValue(json, Map.class);
    }

    private String newMemberId() throws Exception {
        Map<?, ?> map = read(tools.generateRxMember(1, 11L, null, null, null, null, 30, 60));
        return (String) ((Map<?, ?>) ((List<?>) map.get("members")).get(0)).get("memberId");
    }

    @Test
    public void testGenerateRxMember_usesConfiguredRouting() throws Exception {
        Map<?, ?> map = read(tools.generateRxMember(2, 7L, null, null, "GRP777", "F", null, null));

        assertTrue((Boolean) map.get("success"));
        assertEquals(2, map.get("count"));
        Map<?, ?> first = (Map<?, ?>) ((List<?>) map.get("members")).get(0);
        assertEquals("610014", first.get("bin"));
        assertEquals("RXTEST", first.get("pcn"));
        assertEquals("GRP777", first.get("groupNumber"));
        assertEquals("F", ((Map<?, ?>) first.get("demographics")).get("gender"));
        assertEquals(2, registry.size());
    }

    @Test
    public void testGenerateRxMember_invalidBin_returnsInvalidInput() throws Exception {
        Map<?, ?> map = read(tools.generateRxMember(1, 7L, "12", null, null, null, null, null));

        assertFalse((Boolean) map.get("success"));
        assertEquals("INVALID_INPUT", map.get("status"));
        assertEquals(0, registry.size());
    }

    @Test
    public void testAdjudicateThenReverse() throws Exception {
        String memberId = newMemberId();

        Map<?, ?> paid = read(tools.adjudicatePharmacyClaim(memberId, "00093017101", 60.0, 30, 15.0, null, null,
                "RX5001", null, "2025-05-20", null, null, null));

        assertTrue((Boolean) paid.get("success"));
        Map<?, ?> response = (Map<?, ?>) paid.get("response");
        assertEquals("P", response.get("status"));
        assertEquals(10.0, ((Number) response.get("patientPay")).doubleValue());
        assertTrue(((String) paid.get("ncpdp_request")).startsWith("610014D0B1RXTEST"));
        assertTrue(((String) paid.get("ncpdp_response")).startsWith("D0B11A"));

        Map<?, ?> reversal = read(tools.reversePharmacyClaim(memberId, "RX5001", "2025-05-20", null, null));

        assertEquals("A", ((Map<?, ?>) reversal.get("response")).get("status"));
        assertTrue(((String) reversal.get("ncpdp_request")).startsWith("610014D0B2"));
    }

    @Test
    public void testAdjudicate_rejectIsStillSuccessfulCall() throws Exception {
        String memberId = newMemberId();

        Map<?, ?> map = read(tools.adjudicatePharmacyClaim(memberId, "00023361605", 1.0, 30, 120.0, null, null,
                null, null, null, null, null, null));

        assertTrue((Boolean) map.get("success"));
        Map<?, ?> response = (Map<?, ?>) map.get("response");
        assertEquals("R", response.get("status"));
        assertEquals("70", ((Map<?, ?>) ((List<?>) response.get("rejects")).get(0)).get("code"));
    }

    @Test
    public void testAdjudicate_unknownMember() throws Exception {
        Map<?, ?> map = read(tools.adjudicatePharmacyClaim("RXM404", "00093017101", 60.0, 30, 15.0, null, null,
                null, null, null, null, null, null));

        assertEquals("INVALID_INPUT", map.get("status"));
        assertEquals("UNKNOWN_RX_MEMBER", map.get("error_code"));
    }

    @Test
    public void testAdjudicate_reversalCodeIsRejected() throws Exception {
        String memberId = newMemberId();

        Map<?, ?> map = read(tools.adjudicatePharmacyClaim(memberId, "00093017101", 60.0, 30, 15.0, null, null,
                null, null, null, null, null, "B2"));

        assertEquals("INVALID_INPUT", map.get("status"));
    }

    @Test
    public void testReverse_withoutPaidClaimRejects87() throws Exception {
        String memberId = newMemberId();

        Map<?, ?> map = read(tools.reversePharmacyClaim(memberId, "RX9999", "2025-05-20", 0, null));

        Map<?, ?> response = (Map<?, ?>) map.get("response");
        assertEquals("R", response.get("status"));
        assertEquals("87", ((Map<?, ?>) ((List<?>) response.get("rejects")).get(0)).get("code"));
    }

    @Test
    public void testCheckFormularyCoverage() throws Exception {
        Map<?, ?> map = read(tools.checkFormularyCoverage("00074-4339-02"));

        assertEquals("COMM2025", map.get("formulary_id"));
        Map<?, ?> coverage = (Map<?, ?>) map.get("coverage");
        assertEquals(true, coverage.get("requiresPa"));
        assertEquals(5, coverage.get("tier"));
    }

    @Test
    public void testListFormulary_filtersByTier() throws Exception {
        Map<?, ?> map = read(tools.listFormulary(5));

        assertEquals(3, map.get("count"));
        assertEquals(5, ((List<?>) map.get("tiers")).size());
    }

    @Test
    public void testScreenDur_buildsRequest() throws Exception {
        when(durValidator.validate(any())).thenReturn(DurResult.of(List.of()));

        Map<?, ?> map = read(tools.screenDur("00904515260", null, "00056017270, 00093017101", 70, "female", null, null));

        assertTrue((Boolean) map.get("passed"));
        ArgumentCaptor<DurRequest> captor = ArgumentCaptor.forClass(DurRequest.class);
        verify(durValidator).validate(captor.capture());
        DurRequest request = captor.getValue();
        assertEquals(2, request.currentMedications().size());
        assertEquals("00093017101", request.currentMedications().get(1).ndc());
        assertEquals(Gender.F, request.patientGender());
        assertEquals(LocalDate.of(2025, 6, 1), request.serviceDate());
    }

    @Test
    public void testScreenDur_passesGpiForOffFormularyDrug() throws Exception {
        when(durValidator.validate(any())).thenReturn(DurResult.of(List.of()));

        read(tools.screenDur("11111111111", "83300010000330", null, 65, "F", null, null));

        ArgumentCaptor<DurRequest> captor = ArgumentCaptor.forClass(DurRequest.class);
        verify(durValidator).validate(captor.capture());
        assertEquals("83300010000330", captor.getValue().gpi());
    }

    @Test
    public void testScreenDur_missingAge_returnsInvalidInput() throws Exception {
        Map<?, ?> map = read(tools.screenDur("00904515260", null, null, null, null, null, null));

        assertEquals("INVALID_INPUT", map.get("status"));
        verify(durValidator, never()).validate(any());
    }

    @Test
    public void testEvaluatePriorAuthorization_approved() throws Exception {
        String memberId = newMemberId();

        Map<?, ?> map = read(tools.evaluatePriorAuthorization(memberId, "00074433902", "M06.9", null, null, null,
                null, true, true));

        Map<?, ?> decision = (Map<?, ?>) map.get("decision");
        assertEquals("APPROVED", decision.get("status"));
        assertTrue(((String) decision.get("paNumber")).startsWith("PA20250601"));
        assertTrue(((String) map.get("ncpdp_pa_response")).contains("PAResponse"));
    }

    @Test
    public void testEvaluatePriorAuthorization_drugWithoutPa() throws Exception {
        String memberId = newMemberId();

        Map<?, ?> map = read(tools.evaluatePriorAuthorization(memberId, "00093017101", "E11.9", null, null, null,
                null, null, null));

        assertEquals("INVALID_INPUT", map.get("status"));
    }

    @Test
    public void testGetPriorAuthQuestions() throws Exception {
        Map<?, ?> withoutMember = read(tools.getPriorAuthQuestions("00169413512", null));

        assertEquals("GLP1_DIABETES", ((Map<?, ?>) withoutMember.get("question_set")).get("criteriaGroup"));
        assertFalse(withoutMember.containsKey("ncpdp_pa_initiation_response"));

        String memberId = newMemberId();
        Map<?, ?> withMember = read(tools.getPriorAuthQuestions("00169413512", memberId));
        assertTrue(((String) withMember.get("ncpdp_pa_initiation_response")).contains("PAInitiationResponse"));
    }

    @Test
    public void testExportNcpdp() throws Exception {
        Map<?, ?> newRx = read(tools.exportNcpdp("script_newrx", null, 3L, null, null, null));
        assertEquals("SCRIPT_NEWRX", newRx.get("format"));
        assertTrue(((String) newRx.get("content")).contains("NewRx"));

        Map<?, ?> unsupported = read(tools.exportNcpdp("TELECOM_E1", null, 3L, null, null, null));
        assertEquals("INVALID_INPUT", unsupported.get("status"));
    }
}
