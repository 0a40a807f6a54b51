package com.solusoft.ai.healthsim.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.solusoft.ai.healthsim.features.pharmacy.service.AdjudicationEngine;
import com.solusoft.ai.healthsim.features.pharmacy.service.ClaimHistory;
import com.solusoft.ai.healthsim.features.pharmacy.service.Formulary;

/**
 * Reports the loaded formulary and the claim history store backing adjudication.
 */
@Component
public class FormularyHealthIndicator implements HealthIndicator {

    private final AdjudicationEngine engine;

    public FormularyHealthIndicator(AdjudicationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        try {
            Formulary formulary = engine.formulary();
            ClaimHistory history = engine.claimHistory();
            if (formulary.size() == 0) {
                return Health.down()
                    .withDetail("formulary", formulary.formularyId())
                    .withDetail("error", "Formulary has no drugs")
                    .build();
            }
            return Health.up()
                .withDetail("formulary", formulary.formularyId())
                .withDetail("drugs", formulary.size())
                .withDetail("claimStore", history.storeType())
                .withDetail("claimsRecorded", history.count())
                .build();
        } catch (RuntimeException e) {
            return Health.down()
                .withDetail("system", "pharmacy")
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
