package com.solusoft.ai.healthsim.features.pharmacy.model;

/**
 * NCPDP response status (AN): paid, rejected, duplicate of paid, reversal accepted.
 */
public enum ClaimStatusCode {
    P, R, D, A
}
