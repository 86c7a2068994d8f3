package com.comsect1.core.rules;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrossFeatureIsolationCheckTest {

    private static final Path ROOT = Path.of("/work/app").toAbsolutePath();

    CrossFeatureIsolationCheck check = new CrossFeatureIsolationCheck(Map.of(
            "ida_Color", "Color",
            "prx_Color", "Color",
            "ida_Lin", "Lin",
            "poi_Lin", "Lin"
    ));

    private static SourceFile file(String name) {
        return SourceFile.of(ROOT, ROOT.resolve(name));
    }

    @Test
    @DisplayName("referencing another feature's layer class is an error")
    void otherFeature() {
        List<Finding> findings = check.check(file("prx_Color.vb"), new RoleAssignment(Role.PRAXIS, "Color"),
                List.of(Reference.symbol("ida_Lin", 7, "Dim l As ida_Lin")));

        assertEquals(1, findings.size());
        assertEquals(CrossFeatureIsolationCheck.RULE_ID, findings.get(0).rule());
        assertEquals(7, findings.get(0).line());
        assertEquals("Cross-feature reference: references ida_Lin from feature 'Lin' (use stm_ data plane)",
                findings.get(0).message());
    }

    @Test
    @DisplayName("same feature compares case-insensitively")
    void sameFeature() {
        assertTrue(check.check(file("poi_color.vb"), new RoleAssignment(Role.POIESIS, "color"),
                List.of(Reference.symbol("ida_Color", 1, "ida_Color"))).isEmpty());
    }

    @Test
    @DisplayName("shared resources are neither checked nor targets")
    void sharedResources() {
        assertTrue(check.check(file("cfg_Color.vb"), new RoleAssignment(Role.FEATURE_CONFIG, "Color"),
                List.of(Reference.symbol("ida_Lin", 1, "ida_Lin"))).isEmpty());
        assertTrue(check.check(file("ida_Color.vb"), new RoleAssignment(Role.IDEA, "Color"),
                List.of(Reference.symbol("stm_Bus", 1, "stm_Bus"))).isEmpty());
    }
}
