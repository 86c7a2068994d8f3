package com.comsect1.core.engine;

import com.comsect1.core.model.Binding;
import com.comsect1.core.model.GateResult;

import java.nio.file.Path;
import java.util.Set;

/**
 * One source-ecosystem binding of the architecture gate. Both bindings honour the same
 * exit contract so callers can treat them interchangeably.
 */
public interface GateEngine {

    Binding binding();

    /** Runs the gate with the configured default extensions. */
    GateResult run(Path root);

    /**
     * Runs the gate over every file under {@code root} with one of {@code extensions}.
     *
     * @throws com.comsect1.core.scanner.GateConfigurationException if {@code root} is not a directory
     */
    GateResult run(Path root, Set<String> extensions);
}
