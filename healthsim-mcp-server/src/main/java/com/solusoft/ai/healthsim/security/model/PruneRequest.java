package com.solusoft.ai.healthsim.security.model;

public record PruneRequest(String owner) {}
