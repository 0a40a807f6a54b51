package com.solusoft.ai.healthsim.security.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

import com.solusoft.ai.healthsim.security.model.ApiKeyEntity;

public interface ApiKeyRepository extends CrudRepository<ApiKeyEntity, Long> {

    @Query("SELECT * FROM api_keys WHERE key_hash = :hash AND active = 1")
    Optional<ApiKeyEntity> findByHash(@Param("hash") String hash);

    // Newest first
    @Query("SELECT * FROM api_keys WHERE owner = :owner AND active = 1 ORDER BY id DESC")
    List<ApiKeyEntity> findActiveByOwner(@Param("owner") String owner);
}
