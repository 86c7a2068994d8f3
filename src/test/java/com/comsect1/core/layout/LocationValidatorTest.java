package com.comsect1.core.layout;

import com.comsect1.core.classify.RoleClassifier;
import com.comsect1.core.config.GateProperties;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.SourceFile;
import com.comsect1.core.scanner.ArchitectureLayout;
import com.comsect1.fixture.ArchitectureTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocationValidatorTest {

    @TempDir
    Path root;

    LocationValidator validator = new LocationValidator(new GateProperties());

    private List<Finding> validate(String relative) {
        SourceFile file = SourceFile.of(root, root.resolve(relative));
        var layout = new ArchitectureLayout(root);
        return validator.validate(file, RoleClassifier.classify(file.stem())
                .withPathFeature(layout.featureFromPath(file.path())), layout);
    }

    private static List<String> rules(List<Finding> findings) {
        return findings.stream().map(Finding::rule).toList();
    }

    @ParameterizedTest(name = "{0} is correctly placed")
    @ValueSource(strings = {
            "infra/bootstrap/cfg_core.h",
            "infra/bootstrap/ida_core.h",
            "infra/bootstrap/prx_core.c",
            "infra/service/svc_timer.c",
            "infra/platform/hal/hal_gpio.c",
            "infra/platform/bsp/bsp_board.c",
            "deps/middleware/can/mdw_can.c",
            "deps/extern/rtos/mdw_rtos.c",
            "project/features/motor/ida_motor.c",
            "project/features/motor/prx_motor.h",
            "project/features/motor/cfg_motor.h",
            "project/config/cfg_project.h",
            "project/config/db_project.h",
            "project/config/cfg_shared.h",
            "project/datastreams/stm_sensor.h",
            "deps/middleware/bus/stm_bus.h",
            "tools/gen/main.c",
    })
    void acceptsConformingPlacement(String relative) {
        assertEquals(List.of(), validate(relative));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "project/features/motor/svc_timer.c,  path.infra_service",
            "infra/service/hal_gpio.c,            path.infra_hal",
            "infra/platform/hal/bsp_board.c,      path.infra_bsp",
            "infra/service/mdw_can.c,             path.deps_middleware",
            "infra/service/ida_motor.c,           path.project_feature",
            "project/features/motor/ida_core.h,   path.bootstrap",
            "project/features/stm_sensor.h,       path.datastream",
            "project/features/motor/cfg_project.h, path.project_config",
            "infra/service/db_motor.h,            path.feature_resource",
            "infra/service/inf_timer.c,           naming.prefix",
            "project/features/motor/motor.c,      naming.prefix",
    })
    void reportsMisplacement(String relative, String rule) {
        List<Finding> findings = validate(relative);
        assertEquals(List.of(rule), rules(findings));
        assertEquals(1, findings.get(0).line());
    }

    @Test
    @DisplayName("cfg_core.h outside bootstrap is a bootstrap violation only")
    void coreContractOutsideBootstrap() {
        assertEquals(List.of("path.bootstrap"), rules(validate("project/config/cfg_core.h")));
    }

    @Nested
    @DisplayName("nested architecture units")
    class NestedUnits {

        @Test
        @DisplayName("a vendored unit replicating infra/service satisfies the service rule")
        void nestedServiceAccepted() {
            assertEquals(List.of(), validate("deps/extern/vendor/infra/service/svc_log.c"));
        }

        @Test
        @DisplayName("a vendored unit replicating project/features satisfies the feature rule")
        void nestedFeatureAccepted() {
            assertEquals(List.of(), validate("deps/extern/vendor/project/features/fx/ida_fx.c"));
        }

        @Test
        @DisplayName("vendored config without the project layout is exempt")
        void externalNonFractalResource() {
            assertEquals(List.of(), validate("deps/extern/lib/cfg_lib.h"));
        }

        @Test
        @DisplayName("segments outside deps do not make a nested unit")
        void notUnderDeps() {
            assertEquals(List.of("path.infra_service"), rules(validate("tools/vendor/infra/service/svc_log.c")));
        }
    }

    @Test
    @DisplayName("unknown files outside the managed roots are ignored")
    void unknownOutsideManagedRoots() {
        ArchitectureTreeBuilder.at(root).dir("deps");
        assertEquals(List.of(), validate("deps/extern/lib/util.c"));
        assertEquals(List.of(), validate("infra/service/util.c"));
    }
}
