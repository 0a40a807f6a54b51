package com.solusoft.ai.healthsim.security.controller;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.ai.healthsim.security.McpAuthProperties;
import com.solusoft.ai.healthsim.security.model.GenerateKeyRequest;
import com.solusoft.ai.healthsim.security.model.PruneRequest;
import com.solusoft.ai.healthsim.security.service.ApiKeyService;

import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/admin")
@Slf4j
public class AdminKeyController {

    public static final String ADMIN_SECRET_HEADER = "X-ADMIN-SECRET";

    private final ApiKeyService apiKeyService;
    private final McpAuthProperties authProperties;

    public AdminKeyController(ApiKeyService apiKeyService, McpAuthProperties authProperties) {
        this.apiKeyService = apiKeyService;
        this.authProperties = authProperties;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generateNewKey(
            @RequestHeader(value = ADMIN_SECRET_HEADER, required = false) String secret,
            @RequestBody GenerateKeyRequest request) {

        if (!isAdmin(secret)) return forbidden();

        String plainTextKey = apiKeyService.createApiKey(request.owner(), request.role());
        return ResponseEntity.ok(Map.of(
            "status", "created",
            "owner", request.owner(),
            "role", request.role(),
            "api_key", plainTextKey,
            "message", "Key created. Existing keys for this owner remain active until pruned."
        ));
    }

    @PostMapping("/prune")
    public ResponseEntity<?> pruneOldKeys(
            @RequestHeader(value = ADMIN_SECRET_HEADER, required = false) String secret,
            @RequestBody PruneRequest request) {

        if (!isAdmin(secret)) return forbidden();

        int revokedCount = apiKeyService.revokeAllExceptLatest(request.owner());
        return ResponseEntity.ok(Map.of(
            "status", "pruned",
            "owner", request.owner(),
            "keys_revoked", revokedCount,
            "message", revokedCount > 0
                ? "Kept the latest key, revoked " + revokedCount + " older ones."
                : "No cleanup needed. Only 1 key was active."
        ));
    }

    private boolean isAdmin(String secret) {
        String expected = authProperties.getAdminSecret();
        if (expected == null || expected.isBlank() || secret == null) {
            log.warn("Admin request without a configured or presented secret");
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), secret.getBytes(StandardCharsets.UTF_8));
    }

    private ResponseEntity<?> forbidden() {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Invalid Admin Secret"));
    }
}
