package com.solusoft.ai.healthsim.features.members.tool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
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
import com.solusoft.ai.healthsim.config.HealthSimProperties;
import com.solusoft.ai.healthsim.features.members.format.EligibilityFormatter;
import com.solusoft.ai.healthsim.features.members.format.EnrollmentFormatter;
import com.solusoft.ai.healthsim.features.members.format.ProfessionalClaimFormatter;
import com.solusoft.ai.healthsim.features.members.format.RemittanceFormatter;
import com.solusoft.ai.healthsim.features.members.format.ServiceReviewFormatter;
import com.solusoft.ai.healthsim.features.members.format.X12Writer;
import com.solusoft.ai.healthsim.features.members.model.Member;
import com.solusoft.ai.healthsim.features.members.service.ServiceReviewService;

public class MemberMcpToolsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private EnrollmentFormatter enrollmentFormatter;

    @Mock
    private RemittanceFormatter remittanceFormatter;

    private ObjectMapper objectMapper;

    private MemberMcpTools tools;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);

        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());

        X12Writer writer = new X12Writer("HEALTHSIM", "RECEIVER", "T", CLOCK);
        tools = new MemberMcpTools(objectMapper, new HealthSimProperties(), enrollmentFormatter,
                new ProfessionalClaimFormatter(writer, "HEALTHSIM HEALTH PLAN", "HSPAYER01"), remittanceFormatter,
                new EligibilityFormatter(writer, "HEALTHSIM HEALTH PLAN", "HSPAYER01"),
                new ServiceReviewFormatter(writer, "HEALTHSIM HEALTH PLAN", "HSPAYER01"),
                new ServiceReviewService(CLOCK), CLOCK);
    }

    private Map<?, ?> read(String json) throws Exception {
        return objectMapper.readValue(json, Map.class);
    }

    @Test
    public void testGenerateMembers_withClaims() throws Exception {
        Map<?, ?> map = read(tools.generateMembers(2, 42L, "PPO-GOLD", "active", null, null, null, 3));

        assertTrue((Boolean) map.get("success"));
        assertEquals(2, map.get("count"));
        List<?> members = (List<?>) map.get("members");
        Map<?, ?> first = (Map<?, ?>) members.get(0);
        assertEquals("PPO-GOLD", first.get("planCode"));
        assertEquals(3, ((List<?>) first.get("claims")).size());
    }

    @Test
    public void testGenerateMembers_invalidStatus_returnsInvalidInput() throws Exception {
        Map<?, ?> map = read(tools.generateMembers(1, 42L, null, "retired", null, null, null, null));

        assertFalse((Boolean) map.get("success"));
        assertEquals("INVALID_INPUT", map.get("status"));
    }

    @Test
    public void testGenerateMembers_unknownPlan_returnsInvalidInput() throws Exception {
        Map<?, ?> map = read(tools.generateMembers(1, 42L, "GOLD-XL", null, null, null, null, null));

        assertEquals("INVALID_INPUT", map.get("status"));
        assertEquals("UNKNOWN_PLAN", map.get("error_code"));
    }

    @Test
    public void testGenerateFamily_defaultsToSpouseAndTwoChildren() throws Exception {
        Map<?, ?> map = read(tools.generateFamily(null, null, null, 5L));

        assertTrue((Boolean) map.get("success"));
        assertEquals(4, ((List<?>) map.get("members")).size());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testExportX12_834_passesRequestedMembersToFormatter() throws Exception {
        when(enrollmentFormatter.generate834(anyList())).thenReturn("ISA*00~\nST*834*0001~\nSE*2*0001~\n");

        Map<?, ?> map = read(tools.exportX12("834", 4, 9L, "HMO-STANDARD", null, null));

        ArgumentCaptor<List<Member>> captor = ArgumentCaptor.forClass(List.class);
        verify(enrollmentFormatter).generate834(captor.capture());
        assertEquals(4, captor.getValue().size());
        assertTrue(captor.getValue().stream().allMatch(m -> m.planCode().equals("HMO-STANDARD")));
        assertEquals("834", map.get("transaction_type"));
        assertEquals(3, ((Number) map.get("segment_count")).intValue());
    }

    @Test
    public void testExportX12_837P_rendersRealInterchange() throws Exception {
        Map<?, ?> map = read(tools.exportX12("837P", 2, 9L, null, 2, null));

        assertTrue((Boolean) map.get("success"));
        assertEquals("837", map.get("transaction_type"));
        assertTrue(((String) map.get("edi")).contains("ST*837*"));
        verify(remittanceFormatter, never()).generate835(any());
    }

    @Test
    public void testExportX12_unknownType_returnsInvalidInput() throws Exception {
        Map<?, ?> map = read(tools.exportX12("820", null, 1L, null, null, null));

        assertFalse((Boolean) map.get("success"));
        assertEquals("INVALID_INPUT", map.get("status"));
        verify(enrollmentFormatter, never()).generate834(any());
    }

    @Test
    public void testReviewServiceRequest_certifiesSupportedImaging() throws Exception {
        Map<?, ?> map = read(tools.reviewServiceRequest("72148", "M54.5", "2025-06-20", 1, "PPO-GOLD", 3L));

        assertTrue((Boolean) map.get("success"));
        assertEquals("A1", map.get("hcr_code"));
        assertTrue((Boolean) map.get("review_required"));
        assertTrue(((String) map.get("x12_278_response")).contains("HCR*A1*"));
    }

    @Test
    public void testReviewServiceRequest_badDate_returnsInvalidInput() throws Exception {
        Map<?, ?> map = read(tools.reviewServiceRequest("72148", "M54.5", "20-06-2025", 1, null, 3L));

        assertEquals("INVALID_INPUT", map.get("status"));
    }
}
