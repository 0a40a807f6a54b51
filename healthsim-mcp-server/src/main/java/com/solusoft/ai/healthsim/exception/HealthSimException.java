package com.solusoft.ai.healthsim.exception;

/**
 * Base type for every failure raised by the HealthSim generators, engines and formatters.
 */
public class HealthSimException extends RuntimeException {

    private final String errorCode;

    public HealthSimException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public HealthSimException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
