package com.solusoft.ai.healthsim.features.patients.tool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.hl7.fhir.r4.model.Bundle;
import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.common.tool.McpToolSupport;
import com.solusoft.ai.healthsim.config.HealthSimProperties;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.features.patients.format.FhirBundleExporter;
import com.solusoft.ai.healthsim.features.patients.format.Hl7v2MessageBuilder;
import com.solusoft.ai.healthsim.features.patients.model.Patient;
import com.solusoft.ai.healthsim.features.patients.model.PatientConstraints;
import com.solusoft.ai.healthsim.features.patients.model.Scenario;
import com.solusoft.ai.healthsim.features.patients.service.ClinicalCatalog;
import com.solusoft.ai.healthsim.features.patients.service.PatientGenerator;

import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class PatientMcpTools extends McpToolSupport {

    private final FhirBundleExporter fhirExporter;
    private final Hl7v2MessageBuilder hl7Builder;
    private final Clock clock;

    public PatientMcpTools(ObjectMapper objectMapper, HealthSimProperties properties,
                           FhirBundleExporter fhirExporter, Hl7v2MessageBuilder hl7Builder, Clock clock) {
        super(objectMapper, properties);
        this.fhirExporter = fhirExporter;
        this.hl7Builder = hl7Builder;
        this.clock = clock;
    }

    @McpTool(name = "generate_patients",
            description = "Generates synthetic clinical patients (demographics, diagnoses, encounters, medications, "
                    + "labs and vitals). Reuse the returned seed with the same arguments to reproduce the patients.")
    public String generatePatients(
            @McpToolParam(description = "Number of patients (default 1)", required = false) Integer count,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed,
            @McpToolParam(description = "Scenario key, see list_patient_scenarios", required = false) String scenario,
            @McpToolParam(description = "Comma separated condition keys, e.g. diabetes,hypertension", required = false) String conditions,
            @McpToolParam(description = "M or F", required = false) String gender,
            @McpToolParam(description = "Minimum age in years", required = false) Integer minAge,
            @McpToolParam(description = "Maximum age in years", required = false) Integer maxAge) {
        log.info("[TOOL] Entering generate_patients");
        log.debug("Input count: {}, seed: {}, scenario: {}, conditions: {}", count, seed, scenario, conditions);
        try {
            long resolvedSeed = resolveSeed(seed);
            PatientConstraints constraints = constraints(scenario, conditions, gender, minAge, maxAge);
            List<Patient> patients = new PatientGenerator(resolvedSeed, clock)
                    .generateBatch(checkCount(count, 1), constraints);

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("count", patients.size());
            result.put("patients", patients);
            log.info("[TOOL] Exiting generate_patients");
            return toJson(result);
        } catch (Exception e) {
            return handleError("generatePatients", e);
        }
    }

    @McpTool(name = "list_patient_scenarios", description = "Lists the clinical scenarios and condition keys PatientSim understands.")
    public String listPatientScenarios() {
        log.info("[TOOL] Entering list_patient_scenarios");
        try {
            List<Map<String, Object>> scenarios = new ArrayList<>();
            for (Scenario scenario : ClinicalCatalog.scenarios()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("key", scenario.key());
                entry.put("description", scenario.description());
                entry.put("required_conditions", scenario.requiredConditions());
                entry.put("optional_conditions", scenario.optionalConditions());
                entry.put("default_age_range", scenario.defaultAgeRange());
                scenarios.add(entry);
            }
            Map<String, Object> result = success();
            result.put("scenarios", scenarios);
            result.put("conditions", ClinicalCatalog.conditions().stream()
                    .map(c -> Map.of("key", c.key(), "icd10", c.icd10Code(), "description", c.description()))
                    .toList());
            log.info("[TOOL] Exiting list_patient_scenarios");
            return toJson(result);
        } catch (Exception e) {
            return handleError("listPatientScenarios", e);
        }
    }

    @McpTool(name = "export_patients_fhir",
            description = "Generates patients and returns them as a FHIR R4 Bundle (collection or transaction).")
    public String exportPatientsFhir(
            @McpToolParam(description = "Number of patients (default 1)", required = false) Integer count,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed,
            @McpToolParam(description = "Scenario key", required = false) String scenario,
            @McpToolParam(description = "Comma separated condition keys", required = false) String conditions,
            @McpToolParam(description = "collection (default) or transaction", required = false) String bundleType) {
        log.info("[TOOL] Entering export_patients_fhir");
        try {
            long resolvedSeed = resolveSeed(seed);
            List<Patient> patients = new PatientGenerator(resolvedSeed, clock)
                    .generateBatch(checkCount(count, 1), constraints(scenario, conditions, null, null, null));
            Bundle bundle = fhirExporter.toBundle(patients, bundleType(bundleType));

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("resource_count", bundle.getEntry().size());
            result.put("bundle", objectMapper.readTree(fhirExporter.toJson(bundle)));
            log.info("[TOOL] Exiting export_patients_fhir");
            return toJson(result);
        } catch (Exception e) {
            return handleError("exportPatientsFhir", e);
        }
    }

    @McpTool(name = "export_patient_hl7v2",
            description = "Generates one patient and renders an HL7 v2.5.1 message: ADT_A01 (admission), "
                    + "ORM_O01 (lab order) or ORU_R01 (lab results).")
    public String exportPatientHl7v2(
            @McpToolParam(description = "ADT_A01, ORM_O01 or ORU_R01", required = true) String messageType,
            @McpToolParam(description = "Random seed for reproducible output", required = false) Long seed,
            @McpToolParam(description = "Scenario key", required = false) String scenario,
            @McpToolParam(description = "Comma separated condition keys", required = false) String conditions) {
        log.info("[TOOL] Entering export_patient_hl7v2");
        log.debug("Input messageType: {}, seed: {}", messageType, seed);
        try {
            long resolvedSeed = resolveSeed(seed);
            Patient patient = new PatientGenerator(resolvedSeed, clock)
                    .generatePatient(constraints(scenario, conditions, null, null, null));
            String type = messageType == null ? "" : messageType.trim().toUpperCase(Locale.ROOT).replace('^', '_');
            String message;
            switch (type) {
                case "ADT_A01":
                    message = hl7Builder.adtA01(patient, patient.encounters().get(patient.encounters().size() - 1));
                    break;
                case "ORM_O01":
                    message = hl7Builder.ormO01(patient, patient.observations().get(patient.observations().size() - 1));
                    break;
                case "ORU_R01":
                    message = hl7Builder.oruR01(patient, patient.labs().isEmpty() ? patient.observations() : patient.labs());
                    break;
                default:
                    throw new InvalidRequestException("Unsupported HL7 message type: " + messageType);
            }

            Map<String, Object> result = success();
            result.put("seed", resolvedSeed);
            result.put("patient_id", patient.patientId());
            result.put("message_type", type);
            result.put("message", message);
            log.info("[TOOL] Exiting export_patient_hl7v2");
            return toJson(result);
        } catch (Exception e) {
            return handleError("exportPatientHl7v2", e);
        }
    }

    private PatientConstraints constraints(String scenario, String conditions, String gender,
                                           Integer minAge, Integer maxAge) {
        List<String> conditionKeys = csv(conditions);
        AgeRange ageRange = minAge == null && maxAge == null ? null : AgeRange.orDefault(minAge, maxAge, AgeRange.of(0, AgeRange.MAX_AGE));
        return new PatientConstraints(ageRange, Gender.parse(gender), conditionKeys, blankToNull(scenario));
    }

    private static Bundle.BundleType bundleType(String value) {
        if (value == null || value.isBlank() || value.equalsIgnoreCase("collection")) {
            return Bundle.BundleType.COLLECTION;
        }
        if (value.equalsIgnoreCase("transaction")) {
            return Bundle.BundleType.TRANSACTION;
        }
        throw new InvalidRequestException("Unsupported bundle type: " + value);
    }
}
