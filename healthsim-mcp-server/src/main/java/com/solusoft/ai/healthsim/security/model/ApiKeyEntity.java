package com.solusoft.ai.healthsim.security.model;

import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * A client API key; only the SHA-256 hash of the key is stored.
 */
@Table("api_keys")
public class ApiKeyEntity {

    @Id
    private Long id;

    @Column("key_hash")
    private String keyHash;

    private String role;
    private String owner;
    private boolean active = true;

    @Column("created_at")
    private LocalDateTime createdAt = LocalDateTime.now();

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getKeyHash() { return keyHash; }
    public void setKeyHash(String keyHash) { this.keyHash = keyHash; }
    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }
    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
