package com.solusoft.ai.healthsim.features.patients.model;

import java.util.List;
import java.util.Map;

import com.solusoft.ai.healthsim.common.model.AgeRange;

/**
 * A clinical storyline: the conditions it always brings, those it may add (key to probability),
 * its typical ages and the encounter settings it favours.
 */
public record Scenario(
    String key,
    String description,
    List<String> requiredConditions,
    Map<String, Double> optionalConditions,
    AgeRange defaultAgeRange,
    List<EncounterType> encounterTypes
) {}
