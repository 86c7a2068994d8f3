package com.comsect1.dispatch.cli;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.GateResult;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * ANSI-colored terminal output utilities for the comsect1 gate CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "============================================================";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) COMSECT1 GATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [INFO]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void result(String gateName, GateResult result) {
        if (result.noOp()) {
            info("No architecture files found under " + result.root());
            return;
        }
        if (result.findings().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + gateName + " - @|fg(green),bold PASSED|@  (" + result.filesScanned()
                            + " file(s) verified, 0 violations)"));
            System.out.println();
            return;
        }

        String verdict = result.passed()
                ? "@|fg(yellow),bold PASSED (with warnings)|@"
                : "@|fg(red),bold FAILED|@";
        System.out.println();
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + gateName + " - " + verdict + "  (" + result.errorCount() + " error(s), "
                        + result.warningCount() + " warning(s))"));
        System.out.println(RULE);
        for (Finding finding : result.findings()) {
            finding(result.root(), finding);
        }
        System.out.println();
    }

    public static void finding(Path root, Finding finding) {
        String tag = finding.isError() ? "@|fg(red) [FAIL]|@" : "@|fg(yellow) [WARN]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + tag + " " + relativize(root, finding.file()) + ":" + finding.line()
                        + "  [" + finding.rule() + "]  " + finding.message()));
    }

    /** Path relative to the root, or the file name when it lies elsewhere. */
    static String relativize(Path root, String file) {
        Path path = Path.of(file);
        if (path.equals(root)) {
            return ".";
        }
        if (path.startsWith(root)) {
            return root.relativize(path).toString().replace('\\', '/');
        }
        Path name = path.getFileName();
        return name == null ? file : name.toString();
    }
}
