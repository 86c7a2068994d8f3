package com.comsect1.core.rules;

import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates extracted references against a {@link DependencyGraph}: one generic walk over
 * the source role's forbidden edges plus the exemption predicates.
 */
public class DependencyRuleEngine {

    private final DependencyGraph graph;

    public DependencyRuleEngine(DependencyGraph graph) {
        this.graph = graph;
    }

    /**
     * Returns one error per violated edge per reference.
     *
     * @param file       the referencing file
     * @param source     its role and effective feature
     * @param references references extracted from the file
     * @param context    tree-wide facts
     */
    public List<Finding> check(SourceFile file, RoleAssignment source, List<Reference> references,
                               RuleContext context) {
        List<DependencyEdge> edges = graph.edgesFrom(source.role());
        if (edges.isEmpty() || references.isEmpty()) {
            return List.of();
        }
        var findings = new ArrayList<Finding>();
        for (Reference ref : references) {
            if (context.isCoreContract(ref.leaf())) {
                continue;
            }
            for (DependencyEdge edge : edges) {
                if (violates(edge, ref, source, context)) {
                    findings.add(Finding.error(file.displayPath(), ref.line(), edge.ruleId(), edge.render(ref.target())));
                }
            }
        }
        return findings;
    }

    private static boolean violates(DependencyEdge edge, Reference ref, RoleAssignment source, RuleContext context) {
        if (!edge.target().matches(ref, context)) {
            return false;
        }
        if (edge.allowedLeaves().contains(ref.leaf())) {
            return false;
        }
        for (Exemption exemption : edge.exemptions()) {
            if (exemption.allows(ref, source, context)) {
                return false;
            }
        }
        return true;
    }
}
