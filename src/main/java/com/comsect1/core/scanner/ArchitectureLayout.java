package com.comsect1.core.scanner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The comsect1 directory convention resolved against a scanned root.
 * <p>
 * A file inside {@code deps/extern} or {@code deps/middleware} belongs to a
 * <em>nested architecture unit</em> when its path replicates one of the
 * convention segments (for example {@code .../infra/bootstrap/...}); such files
 * satisfy the placement rule of that segment.
 */
public class ArchitectureLayout {

    public static final List<String> BOOTSTRAP = List.of("infra", "bootstrap");
    public static final List<String> SERVICE = List.of("infra", "service");
    public static final List<String> HAL = List.of("infra", "platform", "hal");
    public static final List<String> BSP = List.of("infra", "platform", "bsp");
    public static final List<String> FEATURES = List.of("project", "features");
    public static final List<String> CONFIG = List.of("project", "config");
    public static final List<String> DATASTREAMS = List.of("project", "datastreams");

    /** Top-level folders of the pre-migration layout. */
    public static final List<String> LEGACY = List.of("core/config", "features", "modules", "platform");

    private final Path root;

    public ArchitectureLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public Path resolve(List<String> segments) {
        Path p = root;
        for (String s : segments) {
            p = p.resolve(s);
        }
        return p;
    }

    public Path depsDir() {
        return root.resolve("deps");
    }

    public Path depsExternDir() {
        return depsDir().resolve("extern");
    }

    public Path depsMiddlewareDir() {
        return depsDir().resolve("middleware");
    }

    /** {@code true} when {@code file} lies strictly inside {@code base}. */
    public static boolean isUnder(Path file, Path base) {
        Path f = file.toAbsolutePath().normalize();
        Path b = base.toAbsolutePath().normalize();
        return !f.equals(b) && f.startsWith(b);
    }

    /** Under {@code root/<segments>} at the top level only. */
    public boolean isUnderTopLevel(Path file, List<String> segments) {
        return isUnder(file, resolve(segments));
    }

    public boolean isInsideDependencyCopy(Path file) {
        return isUnder(file, depsExternDir()) || isUnder(file, depsMiddlewareDir());
    }

    /**
     * Under {@code root/<segments>}, or inside a nested architecture unit whose
     * path contains the same consecutive segments.
     */
    public boolean isUnderAny(Path file, List<String> segments) {
        if (isUnderTopLevel(file, segments)) {
            return true;
        }
        return isInsideDependencyCopy(file) && containsSegments(file, segments);
    }

    /**
     * Whether the path relative to the root contains {@code segments} as consecutive
     * directory names, followed by at least one more path element.
     */
    public boolean containsSegments(Path file, List<String> segments) {
        List<String> names = relativeNames(file);
        for (int i = 0; i + segments.size() < names.size(); i++) {
            boolean match = true;
            for (int j = 0; j < segments.size(); j++) {
                if (!names.get(i + j).equals(segments.get(j))) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return true;
            }
        }
        return false;
    }

    /**
     * The feature folder implied by the nearest enclosing {@code project/features/<name>}
     * directory, or {@code null} when the file is not inside one.
     */
    public String featureFromPath(Path file) {
        List<String> names = relativeNames(file);
        // the feature segment must be a directory, so it cannot be the last element
        for (int i = names.size() - 3; i >= 0; i--) {
            if (names.get(i).equals("project") && names.get(i + 1).equals("features")
                    && i + 2 < names.size() - 1) {
                return names.get(i + 2);
            }
        }
        return null;
    }

    private List<String> relativeNames(Path file) {
        Path f = file.toAbsolutePath().normalize();
        Path rel = f.startsWith(root) ? root.relativize(f) : f;
        var names = new ArrayList<String>(rel.getNameCount());
        for (Path part : rel) {
            names.add(part.toString());
        }
        return names;
    }
}
