package com.comsect1.core.report;

/**
 * Thrown when the structured report cannot be serialized or written.
 */
public class ReportWriteException extends RuntimeException {
    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
