package com.comsect1.core.metrics;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.GateResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for gate runs.
 */
@Service
public class GateMetrics {

    private final MeterRegistry registry;

    public GateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(GateResult result, Duration elapsed) {
        Timer.builder("comsect1.gate.duration")
                .tag("binding", result.binding().label())
                .register(registry)
                .record(elapsed);

        String outcome = result.noOp() ? "noop" : result.passed() ? "passed" : "failed";
        Counter.builder("comsect1.gate.runs")
                .tag("binding", result.binding().label())
                .tag("result", outcome)
                .register(registry)
                .increment();

        for (Finding finding : result.findings()) {
            Counter.builder("comsect1.gate.findings")
                    .description("Findings reported by the architecture gate")
                    .tag("severity", finding.severity().label())
                    .tag("rule", finding.rule())
                    .register(registry)
                    .increment();
        }
    }
}
