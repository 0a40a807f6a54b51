package com.solusoft.ai.healthsim.security;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import com.solusoft.ai.healthsim.security.model.ApiKeyEntity;
import com.solusoft.ai.healthsim.security.service.ApiKeyService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates requests carrying {@code X-MCP-API-KEY}. Configured keys are checked first,
 * then hashed keys issued through the admin endpoint. Requests without a valid key stay anonymous
 * and are stopped by the authorization rules.
 */
@Slf4j
public class McpHeaderAuthenticationFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-MCP-API-KEY";

    private final Map<String, String> staticKeys;
    private final ApiKeyService apiKeyService;

    public McpHeaderAuthenticationFilter(Map<String, String> staticKeys, ApiKeyService apiKeyService) {
        this.staticKeys = staticKeys;
        this.apiKeyService = apiKeyService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String clientKey = request.getHeader(API_KEY_HEADER);

        if (StringUtils.hasText(clientKey)) {
            String staticRole = staticKeys.get(clientKey);
            if (staticRole != null) {
                authenticate("McpAgent", staticRole);
            } else {
                try {
                    ApiKeyEntity identity = apiKeyService.validateKey(clientKey);
                    if (identity != null) {
                        authenticate(identity.getOwner(), identity.getRole());
                    } else {
                        log.warn("Rejected unknown API key on {}", request.getRequestURI());
                    }
                } catch (RuntimeException e) {
                    log.error("API key lookup failed: {}", e.getMessage());
                    SecurityContextHolder.clearContext();
                }
            }
        }

        filterChain.doFilter(request, response);
    }

    private static void authenticate(String principal, String role) {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                principal, null, Collections.singletonList(new SimpleGrantedAuthority(role)));
        SecurityContextHolder.getContext().setAuthentication(auth);
    }
}
