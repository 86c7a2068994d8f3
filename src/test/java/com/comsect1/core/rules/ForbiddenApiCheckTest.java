package com.comsect1.core.rules;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.ReferenceKind;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForbiddenApiCheckTest {

    private static final Path ROOT = Path.of("/work/app").toAbsolutePath();

    ForbiddenApiCheck check = new ForbiddenApiCheck();

    private static final List<Reference> REFS = List.of(
            new Reference("ida-no-winforms", "ida-no-winforms", 1, "Imports System.Windows.Forms", ReferenceKind.NAMESPACE_IMPORT),
            new Reference("ida-no-messagebox", "ida-no-messagebox", 9, "MessageBox.Show(x)", ReferenceKind.API_CALL),
            Reference.symbol("prx_Color", 4, "prx_Color.Run()")
    );

    @Test
    @DisplayName("Idea files report each forbidden API at its line")
    void ideaReports() {
        List<Finding> findings = check.check(SourceFile.of(ROOT, ROOT.resolve("ida_Color.vb")),
                new RoleAssignment(Role.IDEA, "Color"), REFS);

        assertEquals(List.of("ida-no-winforms", "ida-no-messagebox"), findings.stream().map(Finding::rule).toList());
        assertEquals("Forbidden in ida_: Imports System.Windows.Forms (WinForms UI layer)", findings.get(0).message());
        assertEquals(9, findings.get(1).line());
    }

    @Test
    @DisplayName("C# imports are described as using directives")
    void csharpDescription() {
        List<Finding> findings = check.check(SourceFile.of(ROOT, ROOT.resolve("ida_Color.cs")),
                new RoleAssignment(Role.IDEA, "Color"), REFS.subList(0, 1));
        assertEquals("Forbidden in ida_: using System.Windows.Forms (WinForms UI layer)", findings.get(0).message());
    }

    @Test
    @DisplayName("Praxis and Poiesis may use platform APIs")
    void otherLayersUnchecked() {
        assertTrue(check.check(SourceFile.of(ROOT, ROOT.resolve("poi_Color.vb")),
                new RoleAssignment(Role.POIESIS, "Color"), REFS).isEmpty());
    }
}
