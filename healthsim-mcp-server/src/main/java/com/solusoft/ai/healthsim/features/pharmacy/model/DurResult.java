package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.util.List;

public record DurResult(
    boolean passed,
    List<DurAlert> alerts,
    int totalAlerts
) {

    public static DurResult of(List<DurAlert> alerts) {
        return new DurResult(alerts.isEmpty(), List.copyOf(alerts), alerts.size());
    }

    /** Lowest severity number present (1 is most severe), or 0 when there are no alerts. */
    public int mostSevere() {
        return alerts.stream().mapToInt(DurAlert::severity).min().orElse(0);
    }
}
