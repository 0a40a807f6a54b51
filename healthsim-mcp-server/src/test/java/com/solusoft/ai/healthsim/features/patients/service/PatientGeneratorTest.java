package com.solusoft.ai.healthsim.features.patients.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Gender;
import com.solusoft.ai.healthsim.exception.InvalidRequestException;
import com.solusoft.ai.healthsim.exception.UnknownReferenceException;
import com.solusoft.ai.healthsim.features.patients.model.Encounter;
import com.solusoft.ai.healthsim.features.patients.model.Observation;
import com.solusoft.ai.healthsim.features.patients.model.Patient;
import com.solusoft.ai.healthsim.features.patients.model.PatientConstraints;

public class PatientGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    @Test
    public void testSameSeed_reproducesBatch() {
        List<Patient> first = new PatientGenerator(42L, CLOCK).generateBatch(3, PatientConstraints.scenario("diabetes"));
        List<Patient> second = new PatientGenerator(42L, CLOCK).generateBatch(3, PatientConstraints.scenario("diabetes"));

        assertEquals(first, second);
    }

    @Test
    public void testDifferentSeed_producesDifferentPatient() {
        Patient a = new PatientGenerator(1L, CLOCK).generatePatient();
        Patient b = new PatientGenerator(2L, CLOCK).generatePatient();

        assertNotEquals(a.patientId() + a.fullName(), b.patientId() + b.fullName());
    }

    @Test
    public void testBatch_hasUniqueIds() {
        List<Patient> patients = new PatientGenerator(9L, CLOCK).generateBatch(25);

        assertEquals(25, patients.stream().map(Patient::patientId).distinct().count());
        assertEquals(25, patients.stream().map(Patient::mrn).distinct().count());
    }

    @Test
    public void testConditionConstraint_addsDiagnosisMedicationAndLabs() {
        Patient patient = new PatientGenerator(5L, CLOCK).generatePatient(PatientConstraints.conditions("diabetes"));

        assertTrue(patient.diagnoses().stream().anyMatch(d -> d.code().equals("E11.9")));
        assertTrue(patient.medications().stream().anyMatch(m -> m.name().equals("Metformin")));
        assertTrue(patient.labs().stream().anyMatch(o -> o.loincCode().equals("4548-4")));
    }

    @Test
    public void testHypertension_yieldsHighBloodPressure() {
        Patient patient = new PatientGenerator(6L, CLOCK).generatePatient(PatientConstraints.conditions("hypertension"));

        Observation systolic = patient.observations().stream()
                .filter(o -> o.loincCode().equals(ClinicalCatalog.SYSTOLIC_BP.loincCode()))
                .findFirst().orElseThrow();
        assertEquals("H", systolic.interpretation());
        assertTrue(systolic.isAbnormal());
    }

    @Test
    public void testScenario_alwaysCarriesRequiredCondition() {
        PatientGenerator generator = new PatientGenerator(11L, CLOCK);
        for (Patient patient : generator.generateBatch(10, PatientConstraints.scenario("cardiac"))) {
            assertTrue(patient.diagnoses().stream().anyMatch(d -> d.code().equals("I25.10")));
        }
    }

    @Test
    public void testAgeAndGenderConstraints_honored() {
        PatientConstraints constraints = new PatientConstraints(AgeRange.of(65, 70), Gender.F, List.of(), null);
        for (Patient patient : new PatientGenerator(13L, CLOCK).generateBatch(20, constraints)) {
            assertEquals(Gender.F, patient.gender());
            assertTrue(patient.age() >= 65 && patient.age() <= 70, "age " + patient.age());
        }
    }

    @Test
    public void testDates_notInFutureAndEncountersOrdered() {
        Patient patient = new PatientGenerator(21L, CLOCK).generatePatient(PatientConstraints.scenario("renal"));

        assertFalse(patient.encounters().isEmpty());
        for (Encounter encounter : patient.encounters()) {
            assertFalse(encounter.admitDate().isAfter(TODAY));
            assertFalse(encounter.dischargeDate().isBefore(encounter.admitDate()));
        }
        patient.diagnoses().forEach(d -> assertFalse(d.onsetDate().isAfter(TODAY)));
        patient.medications().forEach(m -> assertFalse(m.startDate().isAfter(TODAY)));
    }

    @Test
    public void testUnknownScenarioOrCondition_rejected() {
        PatientGenerator generator = new PatientGenerator(1L, CLOCK);

        assertThrows(UnknownReferenceException.class, () -> generator.generatePatient(PatientConstraints.scenario("oncology")));
        assertThrows(UnknownReferenceException.class, () -> generator.generatePatient(PatientConstraints.conditions("gout")));
    }

    @Test
    public void testNegativeCount_rejected() {
        assertThrows(InvalidRequestException.class, () -> new PatientGenerator(1L, CLOCK).generateBatch(-1));
    }
}
