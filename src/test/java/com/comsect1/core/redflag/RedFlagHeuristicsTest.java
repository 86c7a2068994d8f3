package com.comsect1.core.redflag;

import com.comsect1.core.classify.RoleClassifier;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.SourceFile;
import com.comsect1.fixture.ArchitectureTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RedFlagHeuristicsTest {

    @TempDir
    Path root;

    RedFlagHeuristics heuristics = new RedFlagHeuristics(10);

    private Optional<Finding> evaluate(ArchitectureTreeBuilder tree, String relative) {
        SourceFile file = tree.source(relative);
        return heuristics.evaluate(file, RoleClassifier.classify(file.stem()));
    }

    @Nested
    @DisplayName("Empty Idea")
    class EmptyIdea {

        @Test
        @DisplayName("an Idea with few code lines is a whole-file warning")
        void fewCodeLines() {
            var tree = ArchitectureTreeBuilder.at(root).file("ida_motor.c",
                    "#include \"ida_motor.h\"",
                    "/* block",
                    "   comment */",
                    "// note",
                    "",
                    "int ida_motor_run(void) {",
                    "    return 0;",
                    "}");

            Finding f = evaluate(tree, "ida_motor.c").orElseThrow();
            assertFalse(f.isError());
            assertEquals(RedFlagHeuristics.EMPTY_IDEA, f.rule());
            assertEquals(0, f.line());
            assertTrue(f.message().startsWith("Possible Empty Idea: only 3 code line(s) (threshold: 10)"));
        }

        @Test
        @DisplayName("an Idea at the threshold is not flagged")
        void atThreshold() {
            var tree = ArchitectureTreeBuilder.at(root).file("ida_motor.c", ArchitectureTreeBuilder.codeLines(10));
            assertTrue(evaluate(tree, "ida_motor.c").isEmpty());
        }

        @Test
        @DisplayName("ida_core is not subject to the heuristic by default")
        void coreIdea() {
            var tree = ArchitectureTreeBuilder.at(root).file("ida_core.c", "int x;");
            assertTrue(evaluate(tree, "ida_core.c").isEmpty());
        }

        @Test
        @DisplayName("ida_core is checked when core files are included")
        void coreIdeaIncluded() {
            var tree = ArchitectureTreeBuilder.at(root).file("ida_core.vb", "Public Module ida_core", "End Module");
            SourceFile file = tree.source("ida_core.vb");

            Finding f = new RedFlagHeuristics(10, true).evaluate(file, RoleClassifier.classify(file.stem())).orElseThrow();

            assertEquals(RedFlagHeuristics.EMPTY_IDEA, f.rule());
            assertTrue(f.message().startsWith("Possible Empty Idea: only 2 code line(s)"));
        }
    }

    @Nested
    @DisplayName("Fat Poiesis")
    class FatPoiesis {

        @Test
        @DisplayName("domain conditionals are reported once at the first match with a count")
        void domainConditionals() {
            var tree = ArchitectureTreeBuilder.at(root).file("poi_motor.c",
                    "void poi_motor_apply(int v) {",
                    "    // if (mode == FAST) is documented elsewhere",
                    "    if (mode == MODE_FAST) { pwm_set(v); }",
                    "    switch (state) {",
                    "    default: break;",
                    "    }",
                    "}");

            Finding f = evaluate(tree, "poi_motor.c").orElseThrow();
            assertEquals(RedFlagHeuristics.FAT_POIESIS, f.rule());
            assertEquals(3, f.line());
            assertTrue(f.message().startsWith("Possible Fat Poiesis: 2 domain-meaningful conditional(s)"));
        }

        @Test
        @DisplayName("plain register conditionals are not flagged")
        void hardwareConditionals() {
            var tree = ArchitectureTreeBuilder.at(root).file("poi_motor.c",
                    "if (reg & 0x01) { write(reg); }",
                    "if (count > 3) { reset(); }");
            assertTrue(evaluate(tree, "poi_motor.c").isEmpty());
        }
    }

    @Test
    @DisplayName("other roles are never flagged")
    void otherRoles() {
        var tree = ArchitectureTreeBuilder.at(root).file("prx_motor.c", "if (mode) {}");
        assertTrue(evaluate(tree, "prx_motor.c").isEmpty());
    }

    @Test
    @DisplayName("unreadable files yield no warning")
    void unreadable() {
        var tree = ArchitectureTreeBuilder.at(root);
        assertTrue(evaluate(tree, "ida_missing.c").isEmpty());
    }
}
