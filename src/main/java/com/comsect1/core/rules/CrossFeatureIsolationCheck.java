package com.comsect1.core.rules;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.ReferenceKind;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags lateral coupling between features expressed as bare symbol usage.
 * <p>
 * Only Idea/Praxis/Poiesis files take part: shared resources (cfg_, db_, stm_, svc_,
 * mdw_, hal_, bsp_) are not features, so they are neither checked nor reported as targets.
 * Feature names are compared case-insensitively.
 */
public class CrossFeatureIsolationCheck {

    public static final String RULE_ID = "cross-feature-layer-ref";

    private final Map<String, String> featureByClassName;

    /**
     * @param featureByClassName class name to effective feature of every feature-layer file in the run
     */
    public CrossFeatureIsolationCheck(Map<String, String> featureByClassName) {
        this.featureByClassName = Map.copyOf(featureByClassName);
    }

    public List<Finding> check(SourceFile file, RoleAssignment source, List<Reference> references) {
        if (!source.role().isFeatureLayer() || source.feature() == null) {
            return List.of();
        }
        String ownFeature = source.feature().toLowerCase(Locale.ROOT);
        var findings = new ArrayList<Finding>();
        for (Reference ref : references) {
            if (ref.kind() != ReferenceKind.SYMBOL) {
                continue;
            }
            String otherFeature = featureByClassName.get(ref.target());
            if (otherFeature == null || otherFeature.toLowerCase(Locale.ROOT).equals(ownFeature)) {
                continue;
            }
            findings.add(Finding.error(file.displayPath(), ref.line(), RULE_ID,
                    "Cross-feature reference: references " + ref.target() + " from feature '" + otherFeature
                            + "' (use stm_ data plane)"));
        }
        return findings;
    }
}
