package com.comsect1.core.scanner;

/**
 * Thrown when a gate run cannot start, e.g. because the root directory does not exist.
 */
public class GateConfigurationException extends RuntimeException {
    public GateConfigurationException(String message) {
        super(message);
    }

    public GateConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
