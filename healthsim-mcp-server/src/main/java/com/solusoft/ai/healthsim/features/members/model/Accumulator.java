package com.solusoft.ai.healthsim.features.members.model;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Year-to-date benefit accumulator. {@code used} never leaves {@code [0, limit]}.
 */
public class Accumulator {

    public static final String DEDUCTIBLE = "deductible";
    public static final String OUT_OF_POCKET = "out_of_pocket";

    private final String name;
    private final BigDecimal limit;
    private BigDecimal used;

    public Accumulator(String name, BigDecimal limit, BigDecimal used) {
        if (limit.signum() < 0 || used.signum() < 0 || used.compareTo(limit) > 0) {
            throw new IllegalArgumentException(
                    "Accumulator " + name + " requires 0 <= used <= limit, got used=" + used + " limit=" + limit);
        }
        this.name = name;
        this.limit = limit;
        this.used = used;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getLimit() {
        return limit;
    }

    public BigDecimal getUsed() {
        return used;
    }

    @JsonProperty("remaining")
    public BigDecimal remaining() {
        return limit.subtract(used);
    }

    /**
     * Adds up to {@code amount}, stopping at the limit.
     *
     * @return the part of {@code amount} actually applied
     */
    public BigDecimal apply(BigDecimal amount) {
        BigDecimal applied = amount.min(remaining()).max(BigDecimal.ZERO);
        used = used.add(applied);
        return applied;
    }

    /** Reverses a previous {@link #apply}; never goes below zero. */
    public void release(BigDecimal amount) {
        used = used.subtract(amount).max(BigDecimal.ZERO);
    }

    public Accumulator copy() {
        return new Accumulator(name, limit, used);
    }
}
