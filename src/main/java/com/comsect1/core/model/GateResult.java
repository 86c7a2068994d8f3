package com.comsect1.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one gate run.
 *
 * @param binding      which binding produced the result
 * @param root         scanned root directory
 * @param filesScanned number of source files the binding evaluated
 * @param noOp         {@code true} when there was nothing to check; distinct from a pass
 * @param findings     deduplicated findings in report order
 * @param counters     binding-specific counts carried into the report (e.g. files per layer)
 */
public record GateResult(
    Binding binding,
    Path root,
    int filesScanned,
    boolean noOp,
    List<Finding> findings,
    Map<String, Integer> counters
) {

    public long errorCount() {
        return findings.stream().filter(Finding::isError).count();
    }

    public long warningCount() {
        return findings.size() - errorCount();
    }

    /** Warnings alone never fail the gate. */
    public boolean passed() {
        return errorCount() == 0;
    }

    public int exitCode() {
        return passed() ? 0 : 2;
    }
}
