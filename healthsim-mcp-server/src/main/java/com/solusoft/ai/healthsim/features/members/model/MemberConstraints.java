package com.solusoft.ai.healthsim.features.members.model;

import com.solusoft.ai.healthsim.common.model.AgeRange;
import com.solusoft.ai.healthsim.common.model.Gender;

public record MemberConstraints(
    String planCode,
    AgeRange ageRange,
    MemberStatus status,
    Gender gender
) {

    public static MemberConstraints none() {
        return new MemberConstraints(null, null, null, null);
    }

    public static MemberConstraints plan(String planCode) {
        return new MemberConstraints(planCode, null, null, null);
    }
}
