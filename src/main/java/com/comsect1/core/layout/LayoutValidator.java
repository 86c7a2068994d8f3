package com.comsect1.core.layout;

import com.comsect1.core.config.GateProperties;
import com.comsect1.core.model.Finding;
import com.comsect1.core.scanner.ArchitectureLayout;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Tree-level checks: required directories and headers are present, legacy folders are gone.
 * Findings are recorded against the root at line 1 and never stop per-file scanning.
 */
public class LayoutValidator {

    public static final String REQUIRED = "layout.required";
    public static final String LEGACY = "layout.legacy";

    private final GateProperties properties;

    public LayoutValidator(GateProperties properties) {
        this.properties = properties;
    }

    /**
     * @param layout          the resolved convention
     * @param sourceFileCount number of source files found by the scan
     */
    public List<Finding> validate(ArchitectureLayout layout, int sourceFileCount) {
        var findings = new ArrayList<Finding>();
        String root = layout.root().toString();

        Path bootstrap = layout.resolve(ArchitectureLayout.BOOTSTRAP);
        if (!Files.isDirectory(bootstrap)) {
            findings.add(Finding.error(root, 1, REQUIRED, "Missing required infra bootstrap path: " + bootstrap));
        }
        if (!Files.isDirectory(layout.depsDir())) {
            findings.add(Finding.error(root, 1, REQUIRED, "Missing required dependency repository path: " + layout.depsDir()));
        }

        for (String legacy : ArchitectureLayout.LEGACY) {
            Path dir = layout.root().resolve(legacy);
            if (Files.isDirectory(dir)) {
                findings.add(Finding.error(root, 1, LEGACY, legacyMessage(legacy, dir)));
            }
        }

        Path config = layout.resolve(ArchitectureLayout.CONFIG);
        if (!Files.isDirectory(config)) {
            findings.add(Finding.error(root, 1, REQUIRED, "Missing required project config folder: " + config));
        }

        if (sourceFileCount == 0) {
            // required headers are themselves source files; one error covers them
            findings.add(Finding.error(root, 1, REQUIRED, "No source files found under: " + root));
            return findings;
        }

        Path coreContract = bootstrap.resolve(properties.getCoreContractHeader());
        if (!Files.isRegularFile(coreContract)) {
            findings.add(Finding.error(root, 1, REQUIRED, "Missing required Core Contract header: " + coreContract));
        }
        Path projectTarget = config.resolve(properties.getProjectTargetHeader());
        if (Files.isDirectory(config) && !Files.isRegularFile(projectTarget)) {
            findings.add(Finding.error(config.toString(), 1, REQUIRED,
                    "Missing required project target interface header: " + projectTarget));
        }
        return findings;
    }

    private static String legacyMessage(String legacy, Path dir) {
        return switch (legacy) {
            case "core/config" -> "Legacy core config folder detected. Migrate to /infra/bootstrap/cfg_core.h: " + dir;
            case "features" -> "Legacy features folder detected. Migrate to /project/features/: " + dir;
            case "modules" -> "Legacy modules folder detected. Migrate to /infra/ and /deps/: " + dir;
            default -> "Legacy platform folder detected. Migrate to /infra/platform/: " + dir;
        };
    }
}
