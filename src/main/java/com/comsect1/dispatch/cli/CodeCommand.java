package com.comsect1.dispatch.cli;

import com.comsect1.core.engine.IncludeGateEngine;
import com.comsect1.core.report.GateReportWriter;
import com.comsect1.core.scanner.SourceTreeScanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Set;

/**
 * CLI command: comsect1 code --root &lt;dir&gt;
 * <p>
 * Verifies a C-family tree: directory layout, file placement, include direction
 * and the advisory red flags.
 */
@Command(name = "code", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Verify a C-family source tree against the comsect1 architecture rules")
@Component
public class CodeCommand extends GateCommandSupport {

    @Option(names = {"--extensions"}, split = ",",
            description = "File extensions to scan (default: .c,.h,.cpp,.hpp)")
    private Set<String> extensions;

    public CodeCommand(IncludeGateEngine engine, GateReportWriter reportWriter) {
        super(engine, reportWriter);
    }

    @Override
    String gateName() {
        return "comsect1 Code Gate";
    }

    @Override
    Set<String> extensions() {
        return extensions == null || extensions.isEmpty() ? null : SourceTreeScanner.normalizeExtensions(extensions);
    }
}
