package com.comsect1.fixture;

import com.comsect1.core.model.SourceFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds comsect1 source trees inside a test's temporary directory.
 */
public final class ArchitectureTreeBuilder {

    private final Path root;

    private ArchitectureTreeBuilder(Path root) {
        this.root = root;
    }

    public static ArchitectureTreeBuilder at(Path root) {
        return new ArchitectureTreeBuilder(root);
    }

    /**
     * Required directories plus the Core contract and project target headers,
     * i.e. a tree the layout checks accept.
     */
    public ArchitectureTreeBuilder conformingSkeleton() {
        dir("deps/extern");
        dir("deps/middleware");
        dir("project/features");
        dir("project/datastreams");
        dir("infra/service");
        dir("infra/platform/hal");
        dir("infra/platform/bsp");
        file("infra/bootstrap/cfg_core.h", "#ifndef CFG_CORE_H", "#define CFG_CORE_H", "#endif");
        file("project/config/cfg_project.h", "#ifndef CFG_PROJECT_H", "#define CFG_PROJECT_H", "#endif");
        return this;
    }

    public ArchitectureTreeBuilder dir(String relative) {
        try {
            Files.createDirectories(root.resolve(relative));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ArchitectureTreeBuilder file(String relative, String... lines) {
        Path path = root.resolve(relative);
        try {
            Files.createDirectories(path.getParent());
            Files.writeString(path, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public ArchitectureTreeBuilder bytes(String relative, byte[] content) {
        Path path = root.resolve(relative);
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /** Lines of a plausible Idea body with {@code count} code lines. */
    public static String[] codeLines(int count) {
        String[] lines = new String[count];
        for (int i = 0; i < count; i++) {
            lines[i] = "int value" + i + " = " + i + ";";
        }
        return lines;
    }

    public Path root() {
        return root;
    }

    public Path path(String relative) {
        return root.resolve(relative);
    }

    public SourceFile source(String relative) {
        return SourceFile.of(root, root.resolve(relative));
    }
}
