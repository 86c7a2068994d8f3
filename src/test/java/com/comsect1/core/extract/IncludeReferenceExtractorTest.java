package com.comsect1.core.extract;

import com.comsect1.core.model.Reference;
import com.comsect1.core.model.ReferenceKind;
import com.comsect1.fixture.ArchitectureTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IncludeReferenceExtractorTest {

    @TempDir
    Path root;

    IncludeReferenceExtractor extractor = new IncludeReferenceExtractor();

    @Test
    @DisplayName("extracts quoted includes with line numbers and leaf names")
    void quotedIncludes() {
        var tree = ArchitectureTreeBuilder.at(root).file("poi_motor.c",
                "#include \"poi_motor.h\"",
                "  #  include \"../drivers/hal_pwm.h\"",
                "int x;");

        List<Reference> refs = extractor.extract(tree.source("poi_motor.c"));

        assertEquals(2, refs.size());
        assertEquals("poi_motor.h", refs.get(0).leaf());
        assertEquals(1, refs.get(0).line());
        assertEquals("../drivers/hal_pwm.h", refs.get(1).target());
        assertEquals("hal_pwm.h", refs.get(1).leaf());
        assertEquals(2, refs.get(1).line());
        assertEquals(ReferenceKind.INCLUDE, refs.get(1).kind());
    }

    @Test
    @DisplayName("system includes are dropped")
    void systemIncludes() {
        var tree = ArchitectureTreeBuilder.at(root).file("ida_x.c", "#include <stdint.h>", "#include <prx_x.h>");
        assertTrue(extractor.extract(tree.source("ida_x.c")).isEmpty());
    }

    @Test
    @DisplayName("includes inside line and block comments are ignored")
    void commentedIncludes() {
        var tree = ArchitectureTreeBuilder.at(root).file("ida_x.c",
                "// #include \"prx_a.h\"",
                "/*",
                "#include \"prx_b.h\"",
                "*/",
                "#include \"prx_x.h\"");

        List<Reference> refs = extractor.extract(tree.source("ida_x.c"));
        assertEquals(1, refs.size());
        assertEquals("prx_x.h", refs.get(0).target());
        assertEquals(5, refs.get(0).line());
    }

    @Test
    @DisplayName("backslash include paths yield the last segment as leaf")
    void backslashPaths() {
        var tree = ArchitectureTreeBuilder.at(root).file("ida_x.c", "#include \"deps\\\\lib\\\\mdw_lib.h\"");
        Reference ref = extractor.extract(tree.source("ida_x.c")).get(0);
        assertEquals("mdw_lib.h", ref.leaf());
    }

    @Test
    @DisplayName("invalid UTF-8 is a read failure")
    void invalidEncoding() {
        var tree = ArchitectureTreeBuilder.at(root).bytes("ida_x.c", new byte[]{'#', (byte) 0xC3, (byte) 0x28});
        var e = assertThrows(SourceReadException.class, () -> extractor.extract(tree.source("ida_x.c")));
        assertTrue(e.getMessage().startsWith("Failed to read file"));
        assertEquals(tree.path("ida_x.c").toAbsolutePath().normalize(), e.getPath());
    }
}
