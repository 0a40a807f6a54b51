package com.solusoft.ai.healthsim.common.model;

import com.solusoft.ai.healthsim.exception.InvalidRequestException;

/**
 * Inclusive age bounds in whole years.
 */
public record AgeRange(int min, int max) {

    public static final int MAX_AGE = 120;

    public AgeRange {
        if (min < 0 || max > MAX_AGE || min > max) {
            throw new InvalidRequestException(
                    String.format("Invalid age range [%d, %d]: expected 0 <= min <= max <= %d", min, max, MAX_AGE));
        }
    }

    public static AgeRange of(int min, int max) {
        return new AgeRange(min, max);
    }

    /**
     * Builds a range from optional bounds, falling back to the default for a missing side.
     */
    public static AgeRange orDefault(Integer min, Integer max, AgeRange fallback) {
        if (min == null && max == null) {
            return fallback;
        }
        int lower = min != null ? min : Math.min(fallback.min(), max);
        int upper = max != null ? max : Math.max(fallback.max(), min);
        return new AgeRange(lower, upper);
    }

    public boolean contains(int age) {
        return age >= min && age <= max;
    }
}
