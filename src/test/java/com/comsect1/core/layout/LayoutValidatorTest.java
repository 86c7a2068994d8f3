package com.comsect1.core.layout;

import com.comsect1.core.config.GateProperties;
import com.comsect1.core.model.Finding;
import com.comsect1.core.scanner.ArchitectureLayout;
import com.comsect1.fixture.ArchitectureTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutValidatorTest {

    @TempDir
    Path root;

    LayoutValidator validator = new LayoutValidator(new GateProperties());

    private List<Finding> validate(int sourceFiles) {
        return validator.validate(new ArchitectureLayout(root), sourceFiles);
    }

    @Test
    @DisplayName("conforming skeleton produces no findings")
    void conformingSkeleton() {
        ArchitectureTreeBuilder.at(root).conformingSkeleton();
        assertTrue(validate(2).isEmpty());
    }

    @Test
    @DisplayName("empty tree reports missing directories and a single no-sources error")
    void emptyTree() {
        List<Finding> findings = validate(0);

        assertTrue(findings.stream().allMatch(f -> f.rule().equals(LayoutValidator.REQUIRED)));
        assertTrue(findings.stream().allMatch(f -> f.line() == 1 && f.isError()));
        assertEquals(1, findings.stream().filter(f -> f.message().startsWith("No source files found under")).count());
        assertTrue(findings.stream().noneMatch(f -> f.message().contains("Core Contract header")),
                "required headers are covered by the no-sources error");
        assertEquals(4, findings.size());
    }

    @Test
    @DisplayName("required directories without source files give only the no-sources error")
    void requiredDirectoriesWithoutSources() {
        ArchitectureTreeBuilder.at(root).dir("infra/bootstrap").dir("deps").dir("project/config");

        List<Finding> findings = validate(0);

        assertEquals(1, findings.size());
        assertEquals(LayoutValidator.REQUIRED, findings.get(0).rule());
        assertTrue(findings.get(0).message().startsWith("No source files found under"));
    }

    @Test
    @DisplayName("legacy top-level folders are reported")
    void legacyFolders() {
        ArchitectureTreeBuilder.at(root).conformingSkeleton().dir("modules").dir("core/config");

        List<Finding> findings = validate(2);
        assertEquals(2, findings.size());
        assertTrue(findings.stream().allMatch(f -> f.rule().equals(LayoutValidator.LEGACY)));
        assertTrue(findings.stream().anyMatch(f -> f.message().startsWith("Legacy modules folder detected")));
    }

    @Test
    @DisplayName("missing Core Contract and project target headers are reported")
    void missingHeaders() {
        ArchitectureTreeBuilder.at(root).dir("infra/bootstrap").dir("deps").dir("project/config");

        List<Finding> findings = validate(1);
        assertEquals(2, findings.size());
        assertTrue(findings.stream().anyMatch(f -> f.message().startsWith("Missing required Core Contract header")));
        assertTrue(findings.stream().anyMatch(f -> f.message().startsWith("Missing required project target interface header")));
    }
}
