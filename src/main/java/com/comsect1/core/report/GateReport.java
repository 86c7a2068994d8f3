package com.comsect1.core.report;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.GateResult;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Structured report written next to a gate run.
 */
@JsonPropertyOrder({"generatedAtUtc", "binding", "root", "filesScanned", "errorCount", "warningCount",
        "gatePassed", "noOp", "counters", "findings"})
public record GateReport(
    String generatedAtUtc,
    String binding,
    String root,
    int filesScanned,
    long errorCount,
    long warningCount,
    boolean gatePassed,
    boolean noOp,
    List<Finding> findings,
    Map<String, Integer> counters
) {

    public static GateReport from(GateResult result, Instant generatedAt) {
        return new GateReport(
                generatedAt.truncatedTo(ChronoUnit.MILLIS).toString(),
                result.binding().label(),
                result.root().toString(),
                result.filesScanned(),
                result.errorCount(),
                result.warningCount(),
                result.passed(),
                result.noOp(),
                result.findings(),
                result.counters()
        );
    }
}
