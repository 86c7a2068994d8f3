package com.comsect1.core.model;

import java.nio.file.Path;
import java.util.Locale;

/**
 * A source file discovered by the scanner. Immutable for the duration of a run.
 *
 * @param path      absolute, normalized path
 * @param relative  path relative to the scanned root
 * @param stem      filename without its extension
 * @param extension lower-case extension including the dot, or an empty string
 */
public record SourceFile(
    Path path,
    Path relative,
    String stem,
    String extension
) {

    public static SourceFile of(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String name = absolute.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
        return new SourceFile(absolute, root.toAbsolutePath().normalize().relativize(absolute), stem, extension);
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public String displayPath() {
        return path.toString();
    }
}
