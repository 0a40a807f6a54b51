package com.solusoft.ai.healthsim.security.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.solusoft.ai.healthsim.security.McpAuthProperties;
import com.solusoft.ai.healthsim.security.model.GenerateKeyRequest;
import com.solusoft.ai.healthsim.security.model.PruneRequest;
import com.solusoft.ai.healthsim.security.service.ApiKeyService;

public class AdminKeyControllerTest {

    @Mock
    private ApiKeyService apiKeyService;

    private AdminKeyController controller;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        McpAuthProperties properties = new McpAuthProperties();
        properties.setAdminSecret("s3cret");
        controller = new AdminKeyController(apiKeyService, properties);
    }

    @Test
    public void testGenerateWithSecret() {
        when(apiKeyService.createApiKey("claims-team", "ROLE_AGENT")).thenReturn("new-key");

        ResponseEntity<?> response = controller.generateNewKey("s3cret", new GenerateKeyRequest("claims-team", "ROLE_AGENT"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("new-key", ((Map<?, ?>) response.getBody()).get("api_key"));
    }

    @Test
    public void testWrongSecretIsForbidden() {
        ResponseEntity<?> response = controller.generateNewKey("guess", new GenerateKeyRequest("claims-team", "ROLE_AGENT"));

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        assertEquals("Invalid Admin Secret", ((Map<?, ?>) response.getBody()).get("error"));
        verify(apiKeyService, never()).createApiKey(anyString(), anyString());
    }

    @Test
    public void testPruneWithoutSecretIsForbidden() {
        ResponseEntity<?> response = controller.pruneOldKeys(null, new PruneRequest("claims-team"));

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
    }

    @Test
    public void testPruneReportsRevokedCount() {
        when(apiKeyService.revokeAllExceptLatest("claims-team")).thenReturn(2);

        ResponseEntity<?> response = controller.pruneOldKeys("s3cret", new PruneRequest("claims-team"));

        assertEquals(2, ((Map<?, ?>) response.getBody()).get("keys_revoked"));
    }
}
