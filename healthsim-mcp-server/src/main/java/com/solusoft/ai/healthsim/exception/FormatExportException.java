package com.solusoft.ai.healthsim.exception;

public class FormatExportException extends HealthSimException {

    public FormatExportException(String format, Throwable cause) {
        super("EXPORT_FAILED", "Failed to render " + format + ": " + cause.getMessage(), cause);
    }
}
