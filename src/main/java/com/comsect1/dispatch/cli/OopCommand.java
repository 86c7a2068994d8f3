package com.comsect1.dispatch.cli;

import com.comsect1.core.engine.SymbolGateEngine;
import com.comsect1.core.report.GateReportWriter;
import com.comsect1.core.scanner.SourceTreeScanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Set;

/**
 * CLI command: comsect1 oop --root &lt;dir&gt;
 * <p>
 * Verifies a VB.NET or C# tree where layers reference each other by class name.
 * A tree with no ida_/prx_/poi_ files passes without checks.
 */
@Command(name = "oop", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Verify a VB.NET/C# source tree against the comsect1 layer rules")
@Component
public class OopCommand extends GateCommandSupport {

    @Option(names = {"--extensions", "-e"},
            description = "Comma-separated file extensions to scan (default: .vb,.cs)")
    private String extensions;

    public OopCommand(SymbolGateEngine engine, GateReportWriter reportWriter) {
        super(engine, reportWriter);
    }

    @Override
    String gateName() {
        return "comsect1 OOP Gate";
    }

    @Override
    Set<String> extensions() {
        if (extensions == null || extensions.isBlank()) {
            return null;
        }
        Set<String> parsed = SourceTreeScanner.parseExtensions(extensions);
        return parsed.isEmpty() ? null : parsed;
    }
}
