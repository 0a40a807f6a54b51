package com.solusoft.ai.healthsim.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.solusoft.ai.healthsim.security.McpAuthProperties;
import com.solusoft.ai.healthsim.security.McpHeaderAuthenticationFilter;
import com.solusoft.ai.healthsim.security.service.ApiKeyService;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableMethodSecurity(securedEnabled = true)
@Slf4j
public class McpSecurityConfig {

    private final McpAuthProperties authProperties;

    public McpSecurityConfig(McpAuthProperties authProperties) {
        this.authProperties = authProperties;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, ApiKeyService apiKeyService) throws Exception {

        // Configured keys: key -> role
        Map<String, String> runtimeRoleMap = new HashMap<>();
        authProperties.getUsers().forEach((name, user) -> {
            if (user.getKey() != null && user.getRole() != null) {
                runtimeRoleMap.put(user.getKey(), user.getRole());
                log.info("[SEC] Registered principal: {} -> {}", name, user.getRole());
            }
        });

        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/admin/**").permitAll() // guarded by X-ADMIN-SECRET
                .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .anyRequest().authenticated()
            )
            .addFilterBefore(
                new McpHeaderAuthenticationFilter(runtimeRoleMap, apiKeyService),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }
}
