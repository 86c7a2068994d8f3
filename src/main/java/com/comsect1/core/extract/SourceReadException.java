package com.comsect1.core.extract;

import java.nio.file.Path;

/**
 * Thrown when a single source file cannot be read. Engines turn it into a file-level
 * finding and continue with the remaining files.
 */
public class SourceReadException extends RuntimeException {

    private final Path path;

    public SourceReadException(Path path, Throwable cause) {
        super("Failed to read file: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
