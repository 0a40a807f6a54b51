package com.solusoft.ai.healthsim.exception;

/**
 * Raised when a caller names a plan, scenario, condition, drug or transaction that HealthSim does not know.
 */
public class UnknownReferenceException extends HealthSimException {

    public UnknownReferenceException(String kind, String value) {
        super("UNKNOWN_" + kind.toUpperCase().replace(' ', '_'), "Unknown " + kind + ": " + value);
    }
}
