package com.comsect1.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final Comsect1Command comsect1Command;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(Comsect1Command comsect1Command, IFactory factory) {
        this.comsect1Command = comsect1Command;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(comsect1Command, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
