package com.solusoft.ai.healthsim.security.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

import org.springframework.stereotype.Service;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.security.model.ApiKeyEntity;
import com.solusoft.ai.healthsim.security.repository.ApiKeyRepository;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ApiKeyService {

    private final ApiKeyRepository repository;
    private final SecureRandom secureRandom = new SecureRandom();

    public ApiKeyService(ApiKeyRepository repository) {
        this.repository = repository;
    }

    /**
     * Entry point for the auth filter: hashes the presented key and looks up the active entry.
     *
     * @return the key entity, or null when the key is unknown or revoked
     */
    public ApiKeyEntity validateKey(String plainTextKey) {
        return repository.findByHash(hashKey(plainTextKey)).orElse(null);
    }

    public String createApiKey(String owner, String role) {
        if (owner == null || owner.isBlank() || role == null || role.isBlank()) {
            throw new InvalidRequestException("owner and role are required");
        }
        byte[] randomBytes = new byte[32];
        secureRandom.nextBytes(randomBytes);
        String plainTextKey = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);

        ApiKeyEntity entity = new ApiKeyEntity();
        entity.setKeyHash(hashKey(plainTextKey));
        entity.setOwner(owner);
        entity.setRole(role);
        entity.setActive(true);
        repository.save(entity);
        log.info("Issued API key for owner '{}' with role {}", owner, role);

        return plainTextKey;
    }

    /**
     * Keeps the newest active key for the owner and revokes the rest.
     *
     * @return number of keys revoked
     */
    public int revokeAllExceptLatest(String owner) {
        List<ApiKeyEntity> activeKeys = repository.findActiveByOwner(owner);
        if (activeKeys.size() <= 1) {
            return 0;
        }

        int revokedCount = 0;
        for (ApiKeyEntity oldKey : activeKeys.subList(1, activeKeys.size())) {
            oldKey.setActive(false);
            repository.save(oldKey);
            revokedCount++;
        }
        log.info("Revoked {} API key(s) for owner '{}'", revokedCount, owner);
        return revokedCount;
    }

    public String hashKey(String key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            log.error(e.getLocalizedMessage());
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
