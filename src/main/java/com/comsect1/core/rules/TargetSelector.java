package com.comsect1.core.rules;

import com.comsect1.core.model.Reference;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Chooses which references a {@link DependencyEdge} applies to.
 */
@FunctionalInterface
public interface TargetSelector {

    boolean matches(Reference reference, RuleContext context);

    /**
     * Leaf starts with one of the given role tags followed by an underscore. The tag must be
     * lower case when the context matches names case-sensitively.
     */
    static TargetSelector tags(String... tags) {
        List<String> prefixes = Arrays.stream(tags).map(t -> t + "_").toList();
        return (ref, ctx) -> {
            String leaf = ctx.caseSensitiveNames() ? ref.leaf() : ref.leaf().toLowerCase(Locale.ROOT);
            for (String prefix : prefixes) {
                if (leaf.startsWith(prefix)) {
                    return true;
                }
            }
            return false;
        };
    }

    /** Include path with a {@code deps} directory segment. */
    static TargetSelector dependencyPath() {
        Pattern deps = Pattern.compile("(^|[\\\\/])deps([\\\\/]|$)");
        return (ref, ctx) -> deps.matcher(ref.target()).find();
    }

    /** A cfg_/db_/stm_ header that belongs to the project rather than a vendored copy. */
    static TargetSelector projectResource() {
        return (ref, ctx) -> ctx.isProjectResource(ref.leaf());
    }

    default TargetSelector or(TargetSelector other) {
        return (ref, ctx) -> matches(ref, ctx) || other.matches(ref, ctx);
    }
}
