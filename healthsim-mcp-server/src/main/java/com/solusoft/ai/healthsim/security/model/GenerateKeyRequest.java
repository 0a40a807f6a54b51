package com.solusoft.ai.healthsim.security.model;

public record GenerateKeyRequest(String owner, String role) {}
