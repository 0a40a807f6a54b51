package com.solusoft.ai.healthsim.features.members.model;

public enum PlanType {
    PPO, HMO, EPO, HDHP
}
