package com.comsect1.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;

/**
 * A single gate result line.
 *
 * @param severity error or warning
 * @param file     absolute path of the originating file (or the scanned root for layout findings)
 * @param line     1-based line, or 0 when the finding concerns the whole file
 * @param rule     rule identifier, e.g. {@code poi.include}
 * @param message  human-readable explanation
 */
@JsonPropertyOrder({"severity", "file", "line", "rule", "message"})
public record Finding(
    Severity severity,
    String file,
    int line,
    String rule,
    String message
) {

    /** Deterministic report order: file, then line, then rule. */
    public static final Comparator<Finding> REPORT_ORDER = Comparator
            .comparing(Finding::file)
            .thenComparingInt(Finding::line)
            .thenComparing(Finding::rule);

    public static Finding error(String file, int line, String rule, String message) {
        return new Finding(Severity.ERROR, file, line, rule, message);
    }

    public static Finding warning(String file, int line, String rule, String message) {
        return new Finding(Severity.WARNING, file, line, rule, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
