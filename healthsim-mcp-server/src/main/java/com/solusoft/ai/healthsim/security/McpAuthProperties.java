package com.solusoft.ai.healthsim.security;

import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings under {@code mcp.security}: statically configured clients and the admin secret.
 */
@Configuration
@ConfigurationProperties(prefix = "mcp.security")
public class McpAuthProperties {

    // Logical client name (e.g. "desktop-agent") -> key and role
    private Map<String, UserDetail> users = new HashMap<>();

    private String adminSecret;

    public Map<String, UserDetail> getUsers() {
        return users;
    }

    public void setUsers(Map<String, UserDetail> users) {
        this.users = users;
    }

    public String getAdminSecret() {
        return adminSecret;
    }

    public void setAdminSecret(String adminSecret) {
        this.adminSecret = adminSecret;
    }

    public static class UserDetail {
        private String key;
        private String role;

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
    }
}
