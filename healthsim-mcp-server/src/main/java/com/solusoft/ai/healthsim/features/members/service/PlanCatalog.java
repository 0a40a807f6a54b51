package com.solusoft.ai.healthsim.features.members.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.members.model.Plan;
import com.solusoft.ai.healthsim.features.members.model.PlanType;

public final class PlanCatalog {

    private static final Map<String, Plan> PLANS = new LinkedHashMap<>();

    static {
        register(new Plan("PPO-GOLD", "PPO Gold", PlanType.PPO,
                usd(500), usd(1000), usd(3000), usd(6000), usd(20), usd(40), usd(150), 20));
        register(new Plan("PPO-SILVER", "PPO Silver", PlanType.PPO,
                usd(1500), usd(3000), usd(5000), usd(10000), usd(30), usd(60), usd(250), 30));
        register(new Plan("HMO-STANDARD", "HMO Standard", PlanType.HMO,
                usd(750), usd(1500), usd(4000), usd(8000), usd(25), usd(50), usd(200), 20));
        register(new Plan("EPO-BRONZE", "EPO Bronze", PlanType.EPO,
                usd(3000), usd(6000), usd(7500), usd(15000), usd(40), usd(80), usd(350), 40));
        register(new Plan("HDHP-HSA", "High Deductible HSA", PlanType.HDHP,
                usd(1600), usd(3200), usd(4500), usd(9000), usd(0), usd(0), usd(0), 20));
    }

    private PlanCatalog() {
    }

    public static Plan get(String code) {
        Plan plan = code == null ? null : PLANS.get(code.trim().toUpperCase(Locale.ROOT));
        if (plan == null) {
            throw new UnknownReferenceException("plan", code);
        }
        return plan;
    }

    public static List<Plan> all() {
        return new ArrayList<>(PLANS.values());
    }

    public static List<String> codes() {
        return new ArrayList<>(PLANS.keySet());
    }

    private static void register(Plan plan) {
        PLANS.put(plan.code(), plan);
    }

    private static BigDecimal usd(int amount) {
        return BigDecimal.valueOf(amount).setScale(2);
    }
}
