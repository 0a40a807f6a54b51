package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Drug groups with clinical prior authorization criteria, matched on GPI prefix.
 */
public enum PaCriteriaGroup {
    GLP1_DIABETES("GLP-1 agonists for type 2 diabetes", "2717"),
    GLP1_WEIGHT("GLP-1 agonists for chronic weight management", "6125"),
    TNF_BIOLOGIC("TNF inhibitor biologics", "6627", "6629");

    private final String description;
    private final List<String> gpiPrefixes;

    PaCriteriaGroup(String description, String... gpiPrefixes) {
        this.description = description;
        this.gpiPrefixes = List.of(gpiPrefixes);
    }

    public String description() {
        return description;
    }

    public static Optional<PaCriteriaGroup> forGpi(String gpi) {
        if (gpi == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(group -> group.gpiPrefixes.stream().anyMatch(gpi::startsWith))
                .findFirst();
    }
}
