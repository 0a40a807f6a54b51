package com.solusoft.ai.healthsim.features.patients.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.solusoft.ai.healthsim.common.generator.DemographicsGenerator;
import com.solusoft.ai.healthsim.common.generator.GenerationContext;
import com.solusoft.ai.healthsim.common.generator.NpiGenerator;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Demographics;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.patients.model.ClinicalCondition;
import com.solusoft.ai.healthsim.features.patients.model.Diagnosis;
import com.solusoft.ai.healthsim.features.patients.model.Encounter;
import com.solusoft.ai.healthsim.features.patients.model.EncounterType;
import com.solusoft.ai.healthsim.features.patients.model.LabTemplate;
import com.solusoft.ai.healthsim.features.patients.model.Medication;
import com.solusoft.ai.healthsim.features.patients.model.MedicationTemplate;
import com.solusoft.ai.healthsim.features.patients.model.Observation;
import com.solusoft.ai.healthsim.features.patients.model.ObservationCategory;
import com.solusoft.ai.healthsim.features.patients.model.Patient;
import com.solusoft.ai.healthsim.features.patients.model.PatientConstraints;
import com.solusoft.ai.healthsim.features.patients.model.Scenario;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates synthetic clinical patients. Not thread-safe: one instance per seeded run.
 */
@Slf4j
public class PatientGenerator {

    static final AgeRange DEFAULT_AGE_RANGE = AgeRange.of(18, 85);

    private static final String WELLNESS_REASON = "Z00.00";
    private static final List<String> FACILITIES = List.of(
            "Springfield General Hospital", "Riverside Medical Center", "Lakeview Community Clinic",
            "St. Mary's Regional", "Northside Family Practice", "Valley Health Partners");

    private final GenerationContext context;
    private final DemographicsGenerator demographics;
    private final NpiGenerator npis;

    public PatientGenerator(long seed) {
        this(seed, Clock.systemDefaultZone());
    }

    public PatientGenerator(long seed, Clock clock) {
        this.context = new GenerationContext(seed, clock);
        this.demographics = new DemographicsGenerator(context);
        this.npis = new NpiGenerator(context);
    }

    public Patient generatePatient() {
        return generatePatient(PatientConstraints.none());
    }

    public Patient generatePatient(PatientConstraints constraints) {
        Scenario scenario = constraints.scenario() != null ? ClinicalCatalog.scenario(constraints.scenario()) : null;
        List<ClinicalCondition> conditions = resolveConditions(constraints, scenario);

        AgeRange ageRange = constraints.ageRange() != null ? constraints.ageRange()
                : scenario != null ? scenario.defaultAgeRange() : DEFAULT_AGE_RANGE;
        Demographics person = demographics.generate(ageRange, constraints.gender());
        LocalDate today = context.today();

        List<Diagnosis> diagnoses = new ArrayList<>();
        List<Medication> medications = new ArrayList<>();
        for (ClinicalCondition condition : conditions) {
            Diagnosis diagnosis = diagnose(condition, person.dateOfBirth(), today);
            diagnoses.add(diagnosis);
            for (MedicationTemplate template : condition.medications()) {
                medications.add(new Medication(template.name(), template.dose(), template.frequency(),
                        template.route(), template.rxNormCode(), template.ndc(),
                        context.dateBetween(diagnosis.onsetDate(), today)));
            }
        }

        List<EncounterType> encounterTypes = scenario != null ? scenario.encounterTypes()
                : diagnoses.isEmpty() ? List.of(EncounterType.WELLNESS, EncounterType.OUTPATIENT)
                : List.of(EncounterType.OUTPATIENT, EncounterType.EMERGENCY, EncounterType.INPATIENT);
        List<Encounter> encounters = encounters(encounterTypes, diagnoses, person.dateOfBirth(), today);

        LocalDate lastVisit = encounters.get(encounters.size() - 1).admitDate();
        List<Observation> observations = new ArrayList<>();
        for (LabTemplate vital : ClinicalCatalog.VITALS) {
            boolean abnormal = conditions.stream().anyMatch(c -> "hypertension".equals(c.key()))
                    && (vital == ClinicalCatalog.SYSTOLIC_BP || vital == ClinicalCatalog.DIASTOLIC_BP);
            observations.add(observe(vital, abnormal, lastVisit, ObservationCategory.VITAL_SIGNS));
        }
        for (ClinicalCondition condition : conditions) {
            for (LabTemplate lab : condition.labs()) {
                observations.add(observe(lab, context.chance(0.75), lastVisit, ObservationCategory.LABORATORY));
            }
        }

        Patient patient = new Patient(
                context.nextId("PAT"),
                context.nextId("MRN"),
                person,
                person.ageOn(today),
                diagnoses,
                encounters,
                medications,
                observations);
        log.debug("Generated patient {} with {} diagnoses", patient.patientId(), diagnoses.size());
        return patient;
    }

    public List<Patient> generateBatch(int count) {
        return generateBatch(count, PatientConstraints.none());
    }

    public List<Patient> generateBatch(int count, PatientConstraints constraints) {
        if (count < 0) {
            throw new InvalidRequestException("count must be >= 0, was " + count);
        }
        List<Patient> patients = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            patients.add(generatePatient(constraints));
        }
        return patients;
    }

    public List<Scenario> listScenarios() {
        return ClinicalCatalog.scenarios();
    }

    public List<ClinicalCondition> listConditions() {
        return ClinicalCatalog.conditions();
    }

    private List<ClinicalCondition> resolveConditions(PatientConstraints constraints, Scenario scenario) {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : constraints.conditions()) {
            keys.add(ClinicalCatalog.condition(key).key());
        }
        if (scenario != null) {
            keys.addAll(scenario.requiredConditions());
            for (Map.Entry<String, Double> optional : scenario.optionalConditions().entrySet()) {
                if (context.chance(optional.getValue())) {
                    keys.add(optional.getKey());
                }
            }
        } else if (keys.isEmpty() && !context.chance(0.4)) {
            List<ClinicalCondition> all = ClinicalCatalog.conditions();
            for (ClinicalCondition condition : context.sample(all, context.between(1, 2))) {
                keys.add(condition.key());
            }
        }
        List<ClinicalCondition> resolved = new ArrayList<>();
        for (String key : keys) {
            resolved.add(ClinicalCatalog.condition(key));
        }
        return resolved;
    }

    private Diagnosis diagnose(ClinicalCondition condition, LocalDate dob, LocalDate today) {
        LocalDate earliest = dob.isAfter(today.minusYears(10)) ? dob : today.minusYears(10);
        LocalDate onset = context.dateBetween(earliest, today.minusDays(30).isBefore(earliest) ? earliest : today.minusDays(30));
        return new Diagnosis(condition.icd10Code(), condition.description(), onset, true);
    }

    private List<Encounter> encounters(List<EncounterType> types, List<Diagnosis> diagnoses,
                                       LocalDate dob, LocalDate today) {
        int count = context.between(1, 4);
        LocalDate earliest = dob.isAfter(today.minusYears(2)) ? dob : today.minusYears(2);
        List<Encounter> encounters = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            EncounterType type = context.pick(types);
            LocalDate admit = context.dateBetween(earliest, today);
            LocalDate discharge = type == EncounterType.INPATIENT ? admit.plusDays(context.between(1, 6)) : admit;
            String reason = type == EncounterType.WELLNESS || diagnoses.isEmpty()
                    ? WELLNESS_REASON
                    : context.pick(diagnoses).code();
            encounters.add(new Encounter(
                    context.nextId("ENC"),
                    type,
                    admit,
                    discharge,
                    reason,
                    context.pick(FACILITIES),
                    npis.generate()));
        }
        encounters.sort(Comparator.comparing(Encounter::admitDate));
        return encounters;
    }

    private Observation observe(LabTemplate template, boolean abnormal, LocalDate date, ObservationCategory category) {
        double raw = abnormal
                ? context.between(template.abnormalLow(), template.abnormalHigh())
                : context.between(template.normalLow(), template.normalHigh());
        BigDecimal value = BigDecimal.valueOf(raw).setScale(template.scale(), RoundingMode.HALF_UP);
        BigDecimal low = BigDecimal.valueOf(template.normalLow());
        BigDecimal high = BigDecimal.valueOf(template.normalHigh());
        return new Observation(
                template.loincCode(),
                template.display(),
                value,
                template.unit(),
                date,
                low,
                high,
                Observation.interpret(value, low, high),
                category);
    }
}
