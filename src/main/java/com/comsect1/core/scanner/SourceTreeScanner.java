package com.comsect1.core.scanner;

import com.comsect1.core.config.GateProperties;
import com.comsect1.core.model.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Walks a source tree and returns the files whose extension is in the requested set.
 * <p>
 * Version-control and IDE directories configured in
 * {@link GateProperties#getIgnoredDirectories()} are excluded from the walk.
 * Entries that cannot be read are logged and skipped; the rest of the tree is still scanned.
 * The returned list is sorted by path and is the read-only snapshot every
 * later stage of a run works from.
 */
@Service
public class SourceTreeScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceTreeScanner.class);

    private final Set<String> ignoredDirectories;

    public SourceTreeScanner(GateProperties properties) {
        this.ignoredDirectories = Set.copyOf(properties.getIgnoredDirectories());
    }

    /**
     * Scans {@code root} for files with one of the given extensions.
     *
     * @param root       the directory to walk
     * @param extensions lower-case extensions including the leading dot
     * @return the matching files in path order
     * @throws GateConfigurationException if {@code root} is not a directory
     */
    public List<SourceFile> scan(Path root, Set<String> extensions) {
        Path normalizedRoot = requireDirectory(root);
        Set<String> wanted = normalizeExtensions(extensions);

        var collector = new SourceFileCollector(normalizedRoot, wanted, ignoredDirectories);
        try {
            Files.walkFileTree(normalizedRoot, collector);
        } catch (IOException e) {
            throw new GateConfigurationException("Failed to walk source tree " + normalizedRoot + ": " + e.getMessage(), e);
        }
        List<SourceFile> files = collector.files().stream()
                .sorted(Comparator.comparing(SourceFile::path))
                .toList();
        log.debug("Scanned {}: {} file(s) with extensions {}", normalizedRoot, files.size(), wanted);
        return files;
    }

    /**
     * Resolves and validates the root. A missing root is the only fatal condition of a run.
     */
    public static Path requireDirectory(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalized)) {
            throw new GateConfigurationException("Root directory not found: " + normalized);
        }
        return normalized;
    }

    /**
     * Normalizes user-supplied extensions: trims, lower-cases and adds a missing leading dot.
     */
    public static Set<String> normalizeExtensions(Iterable<String> extensions) {
        var result = new TreeSet<String>();
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String trimmed = ext.trim().toLowerCase(Locale.ROOT);
            result.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
        }
        return result;
    }

    /** Splits a comma-separated extension list such as {@code ".vb, cs"}. */
    public static Set<String> parseExtensions(String commaSeparated) {
        return normalizeExtensions(List.of(commaSeparated.split(",")));
    }

    /**
     * Collects matching files during a walk. Failures on single entries are recorded in
     * {@link #skipped()} instead of ending the walk.
     */
    static final class SourceFileCollector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final Set<String> extensions;
        private final Set<String> ignoredDirectories;
        private final List<SourceFile> files = new ArrayList<>();
        private final List<Path> skipped = new ArrayList<>();

        SourceFileCollector(Path root, Set<String> extensions, Set<String> ignoredDirectories) {
            this.root = root;
            this.extensions = extensions;
            this.ignoredDirectories = ignoredDirectories;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && ignoredDirectories.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() || Files.isRegularFile(file)) {
                SourceFile source = SourceFile.of(root, file);
                if (extensions.contains(source.extension())) {
                    files.add(source);
                }
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("Skipping unreadable path {}: {}", file, exc.toString());
            skipped.add(file);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.warn("Directory {} was only partially scanned: {}", dir, exc.toString());
                skipped.add(dir);
            }
            return FileVisitResult.CONTINUE;
        }

        List<SourceFile> files() {
            return files;
        }

        List<Path> skipped() {
            return skipped;
        }
    }
}
