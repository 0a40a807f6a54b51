package com.solusoft.ai.healthsim.features.patients.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.patients.model.ClinicalCondition;
import com.solusoft.ai.healthsim.features.patients.model.EncounterType;
import com.solusoft.ai.healthsim.features.patients.model.LabTemplate;
import com.solusoft.ai.healthsim.features.patients.model.MedicationTemplate;
import com.solusoft.ai.healthsim.features.patients.model.Scenario;

/**
 * Static reference data for PatientSim: conditions, scenarios and vital sign definitions.
 */
public final class ClinicalCatalog {

    public static final LabTemplate SYSTOLIC_BP =
            new LabTemplate("8480-6", "Systolic blood pressure", "mm[Hg]", 90, 120, 135, 165, 0);
    public static final LabTemplate DIASTOLIC_BP =
            new LabTemplate("8462-4", "Diastolic blood pressure", "mm[Hg]", 60, 80, 85, 100, 0);
    public static final LabTemplate HEART_RATE =
            new LabTemplate("8867-4", "Heart rate", "/min", 60, 100, 101, 120, 0);
    public static final LabTemplate BODY_WEIGHT =
            new LabTemplate("29463-7", "Body weight", "kg", 50, 110, 110, 150, 1);
    public static final LabTemplate BMI =
            new LabTemplate("39156-5", "Body mass index (BMI) [Ratio]", "kg/m2", 18.5, 24.9, 25, 38, 1);

    public static final List<LabTemplate> VITALS = List.of(SYSTOLIC_BP, DIASTOLIC_BP, HEART_RATE, BODY_WEIGHT, BMI);

    private static final Map<String, ClinicalCondition> CONDITIONS = new LinkedHashMap<>();
    private static final Map<String, Scenario> SCENARIOS = new LinkedHashMap<>();

    static {
        condition("diabetes", "E11.9", "Type 2 diabetes mellitus without complications",
                List.of(med("Metformin", "500 mg", "BID", "PO", "861007", "00093017101")),
                List.of(lab("4548-4", "Hemoglobin A1c/Hemoglobin.total in Blood", "%", 4.0, 5.6, 7.0, 10.5, 1),
                        lab("2345-7", "Glucose [Mass/volume] in Serum or Plasma", "mg/dL", 70, 99, 130, 250, 0)));
        condition("hypertension", "I10", "Essential (primary) hypertension",
                List.of(med("Lisinopril", "10 mg", "QD", "PO", "314076", "68180051301")),
                List.of(lab("2823-3", "Potassium [Moles/volume] in Serum or Plasma", "mmol/L", 3.5, 5.1, 5.2, 6.0, 1)));
        condition("hyperlipidemia", "E78.5", "Hyperlipidemia, unspecified",
                List.of(med("Atorvastatin", "10 mg", "QD", "PO", "617310", "00071015523")),
                List.of(lab("13457-7", "Cholesterol in LDL [Mass/volume] in Serum or Plasma by calculation", "mg/dL", 0, 99, 130, 220, 0),
                        lab("2093-3", "Cholesterol [Mass/volume] in Serum or Plasma", "mg/dL", 100, 199, 240, 320, 0)));
        condition("coronary_artery_disease", "I25.10",
                "Atherosclerotic heart disease of native coronary artery without angina pectoris",
                List.of(med("Aspirin", "81 mg", "QD", "PO", "243670", "63981056301"),
                        med("Metoprolol succinate", "25 mg", "QD", "PO", "866412", "00186108805")),
                List.of(lab("6598-7", "Troponin T.cardiac [Mass/volume] in Serum or Plasma", "ng/mL", 0, 0.04, 0.05, 0.5, 2)));
        condition("heart_failure", "I50.9", "Heart failure, unspecified",
                List.of(med("Furosemide", "40 mg", "QD", "PO", "313988", "00054429725")),
                List.of(lab("30934-4", "Natriuretic peptide B [Mass/volume] in Serum or Plasma", "pg/mL", 0, 100, 400, 1500, 0)));
        condition("atrial_fibrillation", "I48.91", "Unspecified atrial fibrillation",
                List.of(med("Apixaban", "5 mg", "BID", "PO", "1364445", "00003089421")),
                List.of(lab("3016-3", "Thyrotropin [Units/volume] in Serum or Plasma", "m[IU]/L", 0.4, 4.0, 4.5, 9.0, 2)));
        condition("asthma", "J45.909", "Unspecified asthma, uncomplicated",
                List.of(med("Albuterol sulfate HFA", "90 mcg/actuation", "Q4H PRN", "INH", "745679", "00173068220")),
                List.of(lab("713-8", "Eosinophils/Leukocytes in Blood by Automated count", "%", 0, 6, 7, 15, 1)));
        condition("copd", "J44.9", "Chronic obstructive pulmonary disease, unspecified",
                List.of(med("Tiotropium bromide", "18 mcg", "QD", "INH", "485032", "00597007541")),
                List.of(lab("2019-8", "Carbon dioxide [Partial pressure] in Arterial blood", "mm[Hg]", 35, 45, 46, 60, 0)));
        condition("ckd", "N18.30", "Chronic kidney disease, stage 3 unspecified",
                List.of(med("Sodium bicarbonate", "650 mg", "BID", "PO", "198218", "64980018201")),
                List.of(lab("33914-3", "Glomerular filtration rate/1.73 sq M.predicted", "mL/min/{1.73_m2}", 60, 120, 30, 59, 0),
                        lab("2160-0", "Creatinine [Mass/volume] in Serum or Plasma", "mg/dL", 0.6, 1.3, 1.5, 3.0, 2)));
        condition("depression", "F32.9", "Major depressive disorder, single episode, unspecified",
                List.of(med("Sertraline", "50 mg", "QD", "PO", "312940", "16729011401")),
                List.of(lab("44261-6", "Patient Health Questionnaire 9 item (PHQ-9) total score", "{score}", 0, 4, 10, 24, 0)));
        condition("anxiety", "F41.1", "Generalized anxiety disorder",
                List.of(med("Buspirone", "10 mg", "BID", "PO", "866054", "00093505401")),
                List.of(lab("70274-6", "Generalized anxiety disorder 7 item (GAD-7) total score", "{score}", 0, 4, 10, 21, 0)));

        scenario("cardiac", "Coronary artery disease with common cardiovascular comorbidities",
                List.of("coronary_artery_disease"),
                Map.of("hypertension", 0.7, "hyperlipidemia", 0.7, "heart_failure", 0.3, "atrial_fibrillation", 0.25),
                AgeRange.of(50, 85),
                List.of(EncounterType.OUTPATIENT, EncounterType.EMERGENCY, EncounterType.INPATIENT));
        scenario("diabetes", "Type 2 diabetes with metabolic comorbidities",
                List.of("diabetes"),
                Map.of("hypertension", 0.6, "hyperlipidemia", 0.5, "ckd", 0.2),
                AgeRange.of(40, 80),
                List.of(EncounterType.OUTPATIENT, EncounterType.WELLNESS));
        scenario("respiratory", "Chronic obstructive pulmonary disease, sometimes with asthma overlap",
                List.of("copd"),
                Map.of("asthma", 0.2, "hypertension", 0.4),
                AgeRange.of(50, 85),
                List.of(EncounterType.OUTPATIENT, EncounterType.EMERGENCY, EncounterType.INPATIENT));
        scenario("renal", "Chronic kidney disease stage 3",
                List.of("ckd"),
                Map.of("hypertension", 0.8, "diabetes", 0.5),
                AgeRange.of(55, 85),
                List.of(EncounterType.OUTPATIENT, EncounterType.INPATIENT));
        scenario("behavioral", "Depression with possible anxiety",
                List.of("depression"),
                Map.of("anxiety", 0.6),
                AgeRange.of(18, 65),
                List.of(EncounterType.OUTPATIENT));
        scenario("wellness", "Healthy adult seen for preventive care",
                List.of(),
                Map.of(),
                AgeRange.of(18, 65),
                List.of(EncounterType.WELLNESS));
    }

    private ClinicalCatalog() {
    }

    public static ClinicalCondition condition(String key) {
        ClinicalCondition condition = CONDITIONS.get(normalize(key));
        if (condition == null) {
            throw new UnknownReferenceException("condition", key);
        }
        return condition;
    }

    public static Scenario scenario(String key) {
        Scenario scenario = SCENARIOS.get(normalize(key));
        if (scenario == null) {
            throw new UnknownReferenceException("scenario", key);
        }
        return scenario;
    }

    public static List<ClinicalCondition> conditions() {
        return new ArrayList<>(CONDITIONS.values());
    }

    public static List<Scenario> scenarios() {
        return new ArrayList<>(SCENARIOS.values());
    }

    private static String normalize(String key) {
        return key == null ? "" : key.trim().toLowerCase().replace(' ', '_').replace('-', '_');
    }

    private static void condition(String key, String code, String description,
                                  List<MedicationTemplate> meds, List<LabTemplate> labs) {
        CONDITIONS.put(key, new ClinicalCondition(key, code, description, meds, labs));
    }

    private static void scenario(String key, String description, List<String> required,
                                 Map<String, Double> optional, AgeRange ages, List<EncounterType> types) {
        // Map.of has no stable iteration order; sort so generation stays reproducible
        Map<String, Double> ordered = new LinkedHashMap<>();
        optional.keySet().stream().sorted().forEach(k -> ordered.put(k, optional.get(k)));
        SCENARIOS.put(key, new Scenario(key, description, required, ordered, ages, types));
    }

    private static MedicationTemplate med(String name, String dose, String frequency, String route,
                                          String rxNorm, String ndc) {
        return new MedicationTemplate(name, dose, frequency, route, rxNorm, ndc);
    }

    private static LabTemplate lab(String loinc, String display, String unit, double low, double high,
                                   double abnormalLow, double abnormalHigh, int scale) {
        return new LabTemplate(loinc, display, unit, low, high, abnormalLow, abnormalHigh, scale);
    }
}
