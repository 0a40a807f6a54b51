package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.time.Clock;

/**
 * Tunables for {@link AdjudicationEngine}.
 *
 * @param refillThresholdPercent share of the previous days supply that must elapse before a refill pays
 * @param durRejectSeverity      DUR alerts at or below this severity number reject with 88 unless overridden
 */
public record AdjudicationSettings(int refillThresholdPercent, int durRejectSeverity, Clock clock) {

    public static AdjudicationSettings defaults() {
        return new AdjudicationSettings(75, 2, Clock.systemDefaultZone());
    }
}
