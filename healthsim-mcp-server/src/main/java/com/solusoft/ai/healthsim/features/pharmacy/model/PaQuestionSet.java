package com.solusoft.ai.healthsim.features.pharmacy.model;

import java.util.List;

public record PaQuestionSet(
    String ndc,
    String drugName,
    PaCriteriaGroup criteriaGroup, // null when the drug is reviewed manually
    List<PaQuestion> questions
) {}
