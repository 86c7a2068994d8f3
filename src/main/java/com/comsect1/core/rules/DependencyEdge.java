package com.comsect1.core.rules;

import com.comsect1.core.model.Role;

import java.util.EnumSet;
import java.util.Set;

/**
 * One forbidden edge of the role graph: references from {@code sources} that match
 * {@code target} are violations unless an exemption applies or the leaf is explicitly allowed.
 *
 * @param sources       source roles the edge applies to
 * @param target        selects the forbidden references
 * @param exemptions    escape hatches evaluated for this edge
 * @param allowedLeaves leaf names that are never violations on this edge (e.g. {@code prx_core.h})
 * @param ruleId        finding rule identifier
 * @param message       finding message; {@code {target}} is replaced by the reference target
 */
public record DependencyEdge(
    Set<Role> sources,
    TargetSelector target,
    Set<Exemption> exemptions,
    Set<String> allowedLeaves,
    String ruleId,
    String message
) {

    public static Builder from(Role first, Role... rest) {
        return new Builder(EnumSet.of(first, rest));
    }

    public String render(String target) {
        return message.replace("{target}", target);
    }

    public static final class Builder {
        private final Set<Role> sources;
        private TargetSelector target;
        private final Set<Exemption> exemptions = EnumSet.noneOf(Exemption.class);
        private Set<String> allowedLeaves = Set.of();

        private Builder(Set<Role> sources) {
            this.sources = sources;
        }

        public Builder to(TargetSelector target) {
            this.target = target;
            return this;
        }

        public Builder toTags(String... tags) {
            return to(TargetSelector.tags(tags));
        }

        public Builder unless(Exemption... exemptions) {
            this.exemptions.addAll(Set.of(exemptions));
            return this;
        }

        public Builder except(String... leaves) {
            this.allowedLeaves = Set.of(leaves);
            return this;
        }

        public DependencyEdge as(String ruleId, String message) {
            return new DependencyEdge(Set.copyOf(sources), target, Set.copyOf(exemptions),
                    allowedLeaves, ruleId, message);
        }
    }
}
