package com.comsect1.core.model;

/**
 * Result of classifying a filename stem.
 *
 * @param role    the assigned role, never {@code null}
 * @param feature the feature implied by the filename, or {@code null} when the role
 *                carries none ({@code "core"} for the three Core roles)
 */
public record RoleAssignment(Role role, String feature) {

    public static RoleAssignment of(Role role) {
        return new RoleAssignment(role, null);
    }

    /** Returns a copy whose feature is replaced by the path-derived one, when present. */
    public RoleAssignment withPathFeature(String pathFeature) {
        if (pathFeature == null || pathFeature.isBlank()) {
            return this;
        }
        return new RoleAssignment(role, pathFeature);
    }
}
