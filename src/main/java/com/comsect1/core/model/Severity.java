package com.comsect1.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Finding severity. Only {@link #ERROR} fails the gate.
 */
public enum Severity {
    ERROR,
    WARNING;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
