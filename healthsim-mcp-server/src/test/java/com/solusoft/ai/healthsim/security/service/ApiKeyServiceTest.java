package com.solusoft.ai.healthsim.security.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.security.model.ApiKeyEntity;
import com.solusoft.ai.healthsim.security.repository.ApiKeyRepository;

public class ApiKeyServiceTest {

    @Mock
    private ApiKeyRepository repository;

    private ApiKeyService service;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        service = new ApiKeyService(repository);
    }

    private static ApiKeyEntity active(long id) {
        ApiKeyEntity entity = new ApiKeyEntity();
        entity.setId(id);
        entity.setOwner("claims-team");
        entity.setRole("ROLE_AGENT");
        entity.setActive(true);
        return entity;
    }

    @Test
    public void testCreatedKeyIsStoredHashed() {
        String key = service.createApiKey("claims-team", "ROLE_AGENT");

        ArgumentCaptor<ApiKeyEntity> captor = ArgumentCaptor.forClass(ApiKeyEntity.class);
        verify(repository).save(captor.capture());
        ApiKeyEntity saved = captor.getValue();
        assertEquals(43, key.length());
        assertEquals(service.hashKey(key), saved.getKeyHash());
        assertEquals(64, saved.getKeyHash().length());
        assertTrue(saved.isActive());
    }

    @Test
    public void testOwnerIsRequired() {
        assertThrows(InvalidRequestException.class, () -> service.createApiKey(" ", "ROLE_AGENT"));
    }

    @Test
    public void testValidateKeyLooksUpHash() {
        ApiKeyEntity entity = active(1);
        when(repository.findByHash(service.hashKey("plain"))).thenReturn(Optional.of(entity));

        assertSame(entity, service.validateKey("plain"));
        assertNull(service.validateKey("other"));
    }

    @Test
    public void testHashIsKnownSha256() {
        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", service.hashKey("hello"));
    }

    @Test
    public void testRevokeKeepsNewestKey() {
        ApiKeyEntity newest = active(3);
        ApiKeyEntity older = active(2);
        ApiKeyEntity oldest = active(1);
        when(repository.findActiveByOwner("claims-team")).thenReturn(List.of(newest, older, oldest));

        assertEquals(2, service.revokeAllExceptLatest("claims-team"));
        assertTrue(newest.isActive());
        assertFalse(older.isActive());
        assertFalse(oldest.isActive());
        verify(repository, times(2)).save(any(ApiKeyEntity.class));
    }
}
