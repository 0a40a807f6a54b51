package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.solusoft.ai.healthsim.features.pharmacy.model.CoverageStatus;
import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;
import com.solusoft.ai.healthsim.features.pharmacy.model.TierCostShare;

/**
 * An immutable drug list keyed by NDC with its tier cost-share structure.
 */
public class Formulary {

    private final String formularyId;
    private final String name;
    private final Map<String, FormularyDrug> drugs;
    private final Map<Integer, TierCostShare> tiers;

    public Formulary(String formularyId, String name, List<FormularyDrug> drugs, List<TierCostShare> tiers) {
        this.formularyId = formularyId;
        this.name = name;
        Map<String, FormularyDrug> byNdc = new LinkedHashMap<>();
        drugs.forEach(drug -> byNdc.put(drug.ndc(), drug));
        Map<Integer, TierCostShare> byTier = new LinkedHashMap<>();
        tiers.forEach(tier -> byTier.put(tier.tier(), tier));
        this.drugs = Collections.unmodifiableMap(byNdc);
        this.tiers = Collections.unmodifiableMap(byTier);
    }

    public String formularyId() {
        return formularyId;
    }

    public String name() {
        return name;
    }

    public Optional<FormularyDrug> drug(String ndc) {
        return Optional.ofNullable(ndc == null ? null : drugs.get(normalizeNdc(ndc)));
    }

    public List<FormularyDrug> drugs() {
        return new ArrayList<>(drugs.values());
    }

    public List<TierCostShare> tiers() {
        return new ArrayList<>(tiers.values());
    }

    public TierCostShare tier(int tier) {
        TierCostShare costShare = tiers.get(tier);
        if (costShare == null) {
            throw new IllegalStateException("Formulary " + formularyId + " has no tier " + tier);
        }
        return costShare;
    }

    public int size() {
        return drugs.size();
    }

    public CoverageStatus checkCoverage(String ndc) {
        Optional<FormularyDrug> found = drug(ndc);
        if (found.isEmpty()) {
            return CoverageStatus.notFound(ndc);
        }
        FormularyDrug drug = found.get();
        TierCostShare tier = tier(drug.tier());
        String quantityLimit = drug.hasQuantityLimit()
                ? drug.quantityLimit() + " per " + drug.quantityLimitDays() + " days"
                : null;
        String message;
        if (!drug.covered()) {
            message = drug.name() + " is excluded from " + name;
        } else if (drug.requiresPa()) {
            message = "Covered with prior authorization";
        } else if (drug.stepTherapy()) {
            message = "Covered after step therapy";
        } else {
            message = "Covered";
        }
        return new CoverageStatus(drug.ndc(), drug.name(), drug.covered(), drug.tier(), tier.name(),
                tier.copay(), tier.coinsurancePercent(), drug.requiresPa(), drug.stepTherapy(),
                quantityLimit, message);
    }

    /** Strips dashes so 00093-0171-01 and 00093017101 resolve to the same entry. */
    static String normalizeNdc(String ndc) {
        return ndc.replace("-", "").trim();
    }
}
