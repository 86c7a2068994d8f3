package com.comsect1.core.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArchitectureLayoutTest {

    @TempDir
    Path root;

    private ArchitectureLayout layout() {
        return new ArchitectureLayout(root);
    }

    // ── Placement ────────────────────────────────────────────────────

    @Test
    @DisplayName("isUnder is strict: the base itself is not under itself")
    void isUnderIsStrict() {
        Path base = root.resolve("infra/bootstrap");
        assertTrue(ArchitectureLayout.isUnder(base.resolve("cfg_core.h"), base));
        assertFalse(ArchitectureLayout.isUnder(base, base));
        assertFalse(ArchitectureLayout.isUnder(root.resolve("infra/bootstrapper/x.h"), base));
    }

    @Test
    @DisplayName("top-level placement resolves segments against the root")
    void topLevel() {
        assertTrue(layout().isUnderTopLevel(root.resolve("infra/platform/hal/hal_gpio.c"), ArchitectureLayout.HAL));
        assertFalse(layout().isUnderTopLevel(root.resolve("infra/platform/bsp/hal_gpio.c"), ArchitectureLayout.HAL));
    }

    @Nested
    @DisplayName("nested architecture units")
    class NestedUnits {

        @Test
        @DisplayName("a dependency copy replicating the segments counts as placed")
        void nestedCopyCounts() {
            Path file = root.resolve("deps/extern/vendor/infra/bootstrap/cfg_core.h");
            assertTrue(layout().isInsideDependencyCopy(file));
            assertTrue(layout().isUnderAny(file, ArchitectureLayout.BOOTSTRAP));
        }

        @Test
        @DisplayName("the same segments outside deps/extern or deps/middleware do not count")
        void segmentsElsewhereDoNotCount() {
            Path file = root.resolve("tools/vendor/infra/bootstrap/cfg_core.h");
            assertFalse(layout().isInsideDependencyCopy(file));
            assertFalse(layout().isUnderAny(file, ArchitectureLayout.BOOTSTRAP));
        }

        @Test
        @DisplayName("segments must be followed by at least one more element")
        void segmentsNeedTrailingElement() {
            assertFalse(layout().containsSegments(root.resolve("deps/extern/infra/bootstrap"), ArchitectureLayout.BOOTSTRAP));
            assertTrue(layout().containsSegments(root.resolve("deps/extern/infra/bootstrap/x.h"), ArchitectureLayout.BOOTSTRAP));
        }
    }

    // ── Feature folders ──────────────────────────────────────────────

    @Test
    @DisplayName("featureFromPath returns the folder under project/features")
    void featureFromPath() {
        assertEquals("motor", layout().featureFromPath(root.resolve("project/features/motor/prx_motor.c")));
        assertEquals("motor", layout().featureFromPath(root.resolve("project/features/motor/sub/prx_motor.c")));
    }

    @Test
    @DisplayName("featureFromPath picks the nearest enclosing feature folder")
    void nearestFeatureWins() {
        Path file = root.resolve("project/features/outer/deps/extern/lib/project/features/inner/ida_x.c");
        assertEquals("inner", layout().featureFromPath(file));
    }

    @Test
    @DisplayName("a file directly in project/features has no feature")
    void noFeatureFolder() {
        assertNull(layout().featureFromPath(root.resolve("project/features/ida_motor.c")));
        assertNull(layout().featureFromPath(root.resolve("infra/service/svc_timer.c")));
    }
}
