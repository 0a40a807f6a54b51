package com.solusoft.ai.healthsim.features.pharmacy.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.pharmacy.model.CurrentMedication;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlert;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurAlertType;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurRequest;
import com.solusoft.ai.healthsim.features.pharmacy.model.DurResult;
import com.solusoft.ai.healthsim.features.pharmacy.model.FormularyDrug;

import lombok.extern.slf4j.Slf4j;

/**
 * Prospective drug utilization review. Drug classes are matched on GPI prefixes. A drug
 * on the formulary is classified by its formulary GPI; any other drug needs a GPI on the request.
 */
@Slf4j
public class DurValidator {

    /** A drug class identified by one or more GPI prefixes. */
    record DrugClass(List<String> prefixes) {

        static DrugClass of(String... prefixes) {
            return new DrugClass(List.of(prefixes));
        }

        boolean contains(String gpi) {
            return prefixes.stream().anyMatch(gpi::startsWith);
        }
    }

    // Warfarin and finasteride are also published under the 8330 and 2410 GPI groups
    static final DrugClass WARFARIN = DrugClass.of("83200030", "83300010");
    static final DrugClass NSAID = DrugClass.of("6610");
    static final DrugClass STATIN = DrugClass.of("3940");
    static final DrugClass MACROLIDE = DrugClass.of("0340");
    static final DrugClass SSRI = DrugClass.of("5816");
    static final DrugClass TRAMADOL = DrugClass.of("65100095");
    static final DrugClass ACE_INHIBITOR = DrugClass.of("3610");
    static final DrugClass POTASSIUM_SPARING = DrugClass.of("3750");
    static final DrugClass NITRATE = DrugClass.of("3210");
    static final DrugClass PDE5_INHIBITOR = DrugClass.of("4014");
    static final DrugClass BENZODIAZEPINE = DrugClass.of("5710");
    static final DrugClass TETRACYCLINE = DrugClass.of("0400");
    static final DrugClass FIVE_ALPHA_REDUCTASE = DrugClass.of("5685", "24100070");

    private static final int CLASS_LENGTH = 4;

    private record Interaction(DrugClass first, DrugClass second, int severity, String message) {

        boolean matches(String a, String b) {
            return (first.contains(a) && second.contains(b)) || (second.contains(a) && first.contains(b));
        }
    }

    private static final List<Interaction> INTERACTIONS = List.of(
            new Interaction(WARFARIN, NSAID, 2, "Increased bleeding risk with warfarin and NSAIDs"),
            new Interaction(STATIN, MACROLIDE, 2, "Macrolide raises statin levels, risk of myopathy"),
            new Interaction(SSRI, TRAMADOL, 2, "Serotonin syndrome risk with SSRI and tramadol"),
            new Interaction(ACE_INHIBITOR, POTASSIUM_SPARING, 2, "Hyperkalemia risk with ACE inhibitor and potassium-sparing diuretic"),
            new Interaction(NITRATE, PDE5_INHIBITOR, 1, "Severe hypotension with nitrate and PDE5 inhibitor"));

    private final Formulary formulary;

    public DurValidator(Formulary formulary) {
        this.formulary = formulary;
    }

    public DurResult validate(DurRequest request) {
        String gpi = gpiOf(request.ndc(), request.gpi());
        if (gpi == null) {
            throw new InvalidRequestException("Cannot screen NDC " + request.ndc() + ": no GPI on request or formulary");
        }
        String drugName = request.drugName() != null ? request.drugName() : nameOf(request.ndc());

        List<DurAlert> alerts = new ArrayList<>();
        for (CurrentMedication current : request.currentMedications()) {
            String currentGpi = gpiOf(current.ndc(), current.gpi());
            if (currentGpi == null) {
                log.debug("Skipping current medication {} without a GPI", current.ndc());
                continue;
            }
            String currentName = current.name() != null ? current.name() : nameOf(current.ndc());
            checkInteraction(gpi, currentGpi, currentName, alerts);
            checkDuplication(gpi, request.ndc(), currentGpi, current, currentName, alerts);
            checkEarlyRefill(gpi, request.ndc(), request.serviceDate(), currentGpi, current, currentName, alerts);
        }
        checkDose(request, alerts);
        checkAge(gpi, drugName, request.patientAge(), alerts);
        checkGender(gpi, drugName, request.patientGender(), alerts);

        DurResult result = DurResult.of(alerts);
        log.debug("DUR for {} ({}): {} alert(s)", request.ndc(), request.memberId(), result.totalAlerts());
        return result;
    }

    private void checkInteraction(String gpi, String currentGpi, String currentName, List<DurAlert> alerts) {
        for (Interaction interaction : INTERACTIONS) {
            if (interaction.matches(gpi, currentGpi)) {
                alerts.add(new DurAlert(DurAlertType.DD, interaction.severity(), interaction.message(), currentName));
            }
        }
    }

    private void checkDuplication(String gpi, String ndc, String currentGpi, CurrentMedication current,
            String currentName, List<DurAlert> alerts) {
        boolean sameClass = gpi.regionMatches(0, currentGpi, 0, CLASS_LENGTH);
        boolean sameDrug = gpi.equals(currentGpi) || (ndc != null && ndc.equals(current.ndc()));
        if (sameClass && !sameDrug) {
            alerts.add(new DurAlert(DurAlertType.TD, 2,
                    "Therapeutic duplication with " + currentName + " (GPI class " + gpi.substring(0, CLASS_LENGTH) + ")",
                    currentName));
        }
    }

    private void checkEarlyRefill(String gpi, String ndc, LocalDate serviceDate, String currentGpi,
            CurrentMedication current, String currentName, List<DurAlert> alerts) {
        if (serviceDate == null || current.fillDate() == null || current.daysSupply() == null) {
            return;
        }
        boolean sameDrug = gpi.equals(currentGpi) || (ndc != null && ndc.equals(current.ndc()));
        LocalDate runsOut = current.fillDate().plusDays(current.daysSupply());
        if (sameDrug && runsOut.isAfter(serviceDate)) {
            long remaining = ChronoUnit.DAYS.between(serviceDate, runsOut);
            alerts.add(new DurAlert(DurAlertType.ER, 3,
                    "Early refill: " + remaining + " day(s) of supply remaining from fill on " + current.fillDate(),
                    currentName));
        }
    }

    private void checkDose(DurRequest request, List<DurAlert> alerts) {
        if (request.quantity() == null || request.daysSupply() == null || request.daysSupply() <= 0) {
            return;
        }
        FormularyDrug drug = formulary.drug(request.ndc()).orElse(null);
        if (drug == null || drug.maxDailyUnits() == null) {
            return;
        }
        BigDecimal daily = request.quantity().divide(BigDecimal.valueOf(request.daysSupply()), 2, RoundingMode.HALF_UP);
        if (daily.compareTo(drug.maxDailyUnits()) > 0) {
            alerts.add(new DurAlert(DurAlertType.HD, 2,
                    "Daily dose of " + daily.stripTrailingZeros().toPlainString() + " units exceeds maximum of "
                            + drug.maxDailyUnits().toPlainString(),
                    null));
        }
    }

    private void checkAge(String gpi, String drugName, int age, List<DurAlert> alerts) {
        if (NSAID.contains(gpi) && age >= 65) {
            alerts.add(new DurAlert(DurAlertType.DA, 3,
                    drugName + ": NSAID use at age " + age + " raises GI bleeding and renal risk", null));
        }
        if (BENZODIAZEPINE.contains(gpi) && age >= 65) {
            alerts.add(new DurAlert(DurAlertType.DA, 2,
                    drugName + ": benzodiazepine at age " + age + " (Beers criteria, fall risk)", null));
        }
        if (TETRACYCLINE.contains(gpi) && age < 8) {
            alerts.add(new DurAlert(DurAlertType.DA, 1,
                    drugName + ": tetracyclines are contraindicated under age 8", null));
        }
    }

    private void checkGender(String gpi, String drugName, Gender gender, List<DurAlert> alerts) {
        if (FIVE_ALPHA_REDUCTASE.contains(gpi) && gender == Gender.F) {
            alerts.add(new DurAlert(DurAlertType.DG, 1,
                    drugName + ": 5-alpha-reductase inhibitors are contraindicated in females", null));
        }
    }

    /** Formulary GPI for a listed NDC, otherwise the GPI supplied by the caller. */
    private String gpiOf(String ndc, String gpi) {
        return formulary.drug(ndc)
                .map(FormularyDrug::gpi)
                .orElse(gpi == null || gpi.isBlank() ? null : gpi.trim());
    }

    private String nameOf(String ndc) {
        return formulary.drug(ndc).map(FormularyDrug::name).orElse(ndc);
    }
}
