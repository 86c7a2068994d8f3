package com.comsect1.dispatch.cli;

import com.comsect1.core.engine.GateEngine;
import com.comsect1.core.model.GateResult;
import com.comsect1.core.report.GateReportWriter;
import com.comsect1.core.report.ReportWriteException;
import com.comsect1.core.scanner.GateConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Options and run sequence shared by the gate subcommands: run the engine, print the
 * verdict, optionally write the JSON report, and map the outcome to an exit code.
 */
abstract class GateCommandSupport implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GateCommandSupport.class);

    static final int EXIT_FATAL = 1;

    @Option(names = {"--root", "-r"}, required = true, description = "Root directory of the source tree")
    Path root;

    @Option(names = {"--report", "-o"}, description = "Write a JSON report to this path")
    Path report;

    private final GateEngine engine;
    private final GateReportWriter reportWriter;

    GateCommandSupport(GateEngine engine, GateReportWriter reportWriter) {
        this.engine = engine;
        this.reportWriter = reportWriter;
    }

    /** Display name used in the verdict line. */
    abstract String gateName();

    /** Extensions to scan, normalised, or {@code null} for the configured defaults. */
    abstract Set<String> extensions();

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        GateResult result;
        try {
            Set<String> extensions = extensions();
            result = extensions == null ? engine.run(root) : engine.run(root, extensions);
        } catch (GateConfigurationException e) {
            log.error("{} aborted: {}", gateName(), e.getMessage(), e);
            ConsoleOutput.error(e.getMessage());
            return EXIT_FATAL;
        }

        ConsoleOutput.result(gateName(), result);

        if (report != null) {
            try {
                Path written = reportWriter.write(result, report);
                ConsoleOutput.info("Report written: " + written);
            } catch (ReportWriteException e) {
                log.error("Report could not be written: {}", e.getMessage(), e);
                ConsoleOutput.error(e.getMessage());
                return EXIT_FATAL;
            }
        }
        return result.exitCode();
    }
}
