package com.solusoft.ai.healthsim.exception;

public class InvalidRequestException extends HealthSimException {

    public InvalidRequestException(String message) {
        super("INVALID_INPUT", message);
    }
}
