package com.solusoft.ai.healthsim.features.members.model;

import com.solusoft.ai.healthsim.common.model.Address;

public record Provider(
    String npi,
    String name,
    String taxId,
    Address address
) {}
