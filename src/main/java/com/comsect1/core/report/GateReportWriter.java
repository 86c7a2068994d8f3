package com.comsect1.core.report;

import com.comsect1.core.model.GateResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Writes a {@link GateReport} as pretty-printed UTF-8 JSON.
 */
@Service
public class GateReportWriter {

    private static final Logger log = LoggerFactory.getLogger(GateReportWriter.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GateReportWriter() {
        this(Clock.systemUTC());
    }

    GateReportWriter(Clock clock) {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * @return the absolute path written
     * @throws ReportWriteException if serialization or the write fails
     */
    public Path write(GateResult result, Path destination) {
        Path target = destination.toAbsolutePath().normalize();
        GateReport report = GateReport.from(result, clock.instant());
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            objectMapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write report " + target + ": " + e.getMessage(), e);
        }
        log.info("Wrote {} report with {} finding(s) to {}", report.binding(), report.findings().size(), target);
        return target;
    }
}
