package com.solusoft.ai.healthsim.features.pharmacy.model;

public enum PriorAuthStatus {
    APPROVED, DENIED, PENDED
}
