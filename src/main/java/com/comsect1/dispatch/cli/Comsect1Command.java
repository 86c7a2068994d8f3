package com.comsect1.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for the comsect1 gate.
 * Routes to subcommands: code, oop.
 */
@Command(
        name = "comsect1",
        mixinStandardHelpOptions = true,
        version = "comsect1-gate 0.1.0",
        exitCodeOnInvalidInput = 1,
        description = "Layered-architecture conformance gate for comsect1 source trees",
        subcommands = {
                CodeCommand.class,
                OopCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class Comsect1Command implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
