package com.solusoft.ai.healthsim.common.model;

public record Address(
    String line1,
    String city,
    String state,
    String postalCode
) {}
