package com.comsect1.core.layout;

import com.comsect1.core.config.GateProperties;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;
import com.comsect1.core.scanner.ArchitectureLayout;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.comsect1.core.scanner.ArchitectureLayout.BOOTSTRAP;
import static com.comsect1.core.scanner.ArchitectureLayout.CONFIG;
import static com.comsect1.core.scanner.ArchitectureLayout.DATASTREAMS;
import static com.comsect1.core.scanner.ArchitectureLayout.FEATURES;

/**
 * Decides whether a file lives in the directory its role requires.
 * <p>
 * Every placement rule except Middleware and DataStream also accepts a nested
 * architecture unit: a copy under {@code deps/extern} or {@code deps/middleware}
 * that replicates the required path segment.
 */
public class LocationValidator {

    private final GateProperties properties;

    public LocationValidator(GateProperties properties) {
        this.properties = properties;
    }

    public List<Finding> validate(SourceFile file, RoleAssignment assignment, ArchitectureLayout layout) {
        var findings = new ArrayList<Finding>();
        Path path = file.path();
        String name = file.fileName();
        Role role = assignment.role();

        if (role == Role.INVALID_PREFIX) {
            findings.add(error(file, "naming.prefix",
                    "Invalid role prefix 'inf_'. Keep role prefixes (ida_/prx_/poi_/mdw_/svc_/hal_/bsp_/stm_/cfg_/db_)."));
            return findings;
        }
        if (role == Role.UNKNOWN) {
            // outside the managed roots non-convention files are ignored
            boolean managed = layout.isUnderTopLevel(path, FEATURES) || layout.isUnderTopLevel(path, CONFIG)
                    || layout.isUnderTopLevel(path, DATASTREAMS) || layout.isUnderTopLevel(path, BOOTSTRAP);
            if (managed) {
                findings.add(error(file, "naming.prefix", "Unknown architecture file role prefix: " + name));
            }
            return findings;
        }

        boolean nested = layout.isInsideDependencyCopy(path);
        boolean inExtern = ArchitectureLayout.isUnder(path, layout.depsExternDir());
        boolean inMiddleware = ArchitectureLayout.isUnder(path, layout.depsMiddlewareDir());

        if (name.equalsIgnoreCase(properties.getCoreContractHeader()) && !layout.isUnderAny(path, BOOTSTRAP)) {
            findings.add(error(file, "path.bootstrap",
                    name + " must be located under /infra/bootstrap (root or nested architecture unit)."));
        }

        switch (role) {
            case CORE_IDEA, CORE_PRAXIS, CORE_POIESIS -> {
                if (!layout.isUnderAny(path, BOOTSTRAP)) {
                    findings.add(error(file, "path.bootstrap", role.tag()
                            + "_core must be located under /infra/bootstrap (root or nested architecture unit)."));
                }
            }
            case SERVICE -> requireUnder(findings, file, layout, ArchitectureLayout.SERVICE, "path.infra_service",
                    "svc_* files must be located under /infra/service (root or nested architecture unit).");
            case HAL -> requireUnder(findings, file, layout, ArchitectureLayout.HAL, "path.infra_hal",
                    "hal_* files must be located under /infra/platform/hal (root or nested architecture unit).");
            case BSP -> requireUnder(findings, file, layout, ArchitectureLayout.BSP, "path.infra_bsp",
                    "bsp_* files must be located under /infra/platform/bsp (root or nested architecture unit).");
            case MIDDLEWARE -> {
                if (!inMiddleware && !inExtern) {
                    findings.add(error(file, "path.deps_middleware",
                            "mdw_* files must be located under /deps/middleware or /deps/extern."));
                }
            }
            case IDEA, PRAXIS, POIESIS -> requireUnder(findings, file, layout, FEATURES, "path.project_feature",
                    role.tag() + "_* feature files must be located under /project/features (root or nested architecture unit).");
            case FEATURE_CONFIG, FEATURE_DATA -> validateResource(findings, file, role, layout, nested);
            case DATA_STREAM -> {
                if (!layout.isUnderAny(path, DATASTREAMS) && !inMiddleware && !inExtern) {
                    findings.add(error(file, "path.datastream",
                            "stm_* files must be located under /project/datastreams/, /deps/middleware/, or /deps/extern/: " + name));
                }
            }
            default -> {
                // UNKNOWN and INVALID_PREFIX handled above
            }
        }
        return findings;
    }

    private void validateResource(List<Finding> findings, SourceFile file, Role role,
                                  ArchitectureLayout layout, boolean nested) {
        Path path = file.path();
        String name = file.fileName();
        // vendored config/data that does not replicate the project layout is not ours to place
        boolean externalNonFractal = nested && !layout.containsSegments(path, FEATURES)
                && !layout.containsSegments(path, CONFIG);
        if (externalNonFractal || name.equalsIgnoreCase(properties.getCoreContractHeader())) {
            return;
        }
        String singleton = role == Role.FEATURE_CONFIG
                ? properties.getProjectTargetHeader()
                : properties.getProjectDatabaseHeader();
        if (name.equalsIgnoreCase(singleton)) {
            if (!layout.isUnderAny(path, CONFIG)) {
                findings.add(error(file, "path.project_config",
                        name + " must be located under /project/config (root or nested architecture unit)."));
            }
        } else if (!layout.isUnderAny(path, FEATURES) && !layout.isUnderAny(path, CONFIG)) {
            findings.add(error(file, "path.feature_resource", role.tag()
                    + "_* feature files must be located under /project/features/ or /project/config/ (root or nested architecture unit): " + name));
        }
    }

    private static void requireUnder(List<Finding> findings, SourceFile file, ArchitectureLayout layout,
                                     List<String> segments, String rule, String message) {
        if (!layout.isUnderAny(file.path(), segments)) {
            findings.add(error(file, rule, message));
        }
    }

    private static Finding error(SourceFile file, String rule, String message) {
        return Finding.error(file.displayPath(), 1, rule, message);
    }
}
