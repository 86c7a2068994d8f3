package com.comsect1.core.rules;

import com.comsect1.core.model.Reference;
import com.comsect1.core.model.RoleAssignment;

/**
 * Escape hatches that allow an otherwise forbidden edge.
 * The shared Core contract is exempt from every edge and is handled by the engine itself.
 */
public enum Exemption {

    /** Target belongs to the source file's own feature. */
    SAME_FEATURE {
        @Override
        boolean allows(Reference reference, RoleAssignment source, RuleContext context) {
            return context.isSameFeature(reference.leaf(), source.feature());
        }
    },

    /** Target is a project-wide header in {@code project/config}. */
    PROJECT_SHARED {
        @Override
        boolean allows(Reference reference, RoleAssignment source, RuleContext context) {
            return context.isProjectShared(reference.leaf());
        }
    };

    abstract boolean allows(Reference reference, RoleAssignment source, RuleContext context);
}
