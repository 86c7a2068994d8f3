package com.comsect1.core.rules;

import com.comsect1.core.model.Role;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.comsect1.core.model.Role.*;
import static com.comsect1.core.rules.Exemption.PROJECT_SHARED;
import static com.comsect1.core.rules.Exemption.SAME_FEATURE;

/**
 * The static directed role graph, as a table of forbidden edges keyed by source role.
 */
public final class DependencyGraph {

    private static final DependencyGraph INCLUDE = new DependencyGraph(List.of(
            DependencyEdge.from(CORE_IDEA, CORE_PRAXIS, CORE_POIESIS, IDEA, PRAXIS, POIESIS)
                    .to(TargetSelector.dependencyPath())
                    .as("include.deps_path", "Do not include dependency repository paths directly from core/project layers: {target}"),

            // Core Idea
            DependencyEdge.from(CORE_IDEA).toTags("prx").except("prx_core.h")
                    .as("ida_core.include", "ida_core must not include feature praxis: {target}"),
            DependencyEdge.from(CORE_IDEA).toTags("poi").except("poi_core.h")
                    .as("ida_core.include", "ida_core must not include feature poiesis: {target}"),
            DependencyEdge.from(CORE_IDEA).toTags("cfg")
                    .as("ida_core.include", "ida_core may include only core contract headers: {target}"),
            DependencyEdge.from(CORE_IDEA).toTags("db", "stm", "mdw", "svc", "hal", "bsp")
                    .as("ida_core.include", "ida_core must not include lower layer/resource headers directly: {target}"),

            // Idea
            DependencyEdge.from(IDEA).toTags("prx").unless(SAME_FEATURE)
                    .as("ida.include", "Idea must include only its own feature Praxis headers: {target}"),
            DependencyEdge.from(IDEA).toTags("poi").unless(SAME_FEATURE)
                    .as("ida.include", "Idea must include only its own feature Poiesis headers: {target}"),
            DependencyEdge.from(IDEA).toTags("ida").unless(SAME_FEATURE)
                    .as("ida.include", "Idea must not include other features' Idea headers: {target}"),
            DependencyEdge.from(IDEA).toTags("cfg")
                    .as("ida.include", "Idea must not include cfg_ directly (except core contract): {target}"),
            DependencyEdge.from(IDEA).toTags("db", "stm", "mdw", "svc", "hal", "bsp")
                    .as("ida.include", "Idea must not include lower layer/resource headers directly: {target}"),

            // Core Poiesis
            DependencyEdge.from(CORE_POIESIS).toTags("ida").except("ida_core.h")
                    .as("poi_core.include", "poi_core must not include feature ideas: {target}"),
            DependencyEdge.from(CORE_POIESIS).toTags("prx", "poi").except("poi_core.h")
                    .as("poi_core.include", "poi_core must not include feature PRX/POI headers: {target}"),
            DependencyEdge.from(CORE_POIESIS).toTags("hal", "bsp")
                    .as("poi_core.include", "poi_core must not include platform headers directly: {target}"),
            DependencyEdge.from(CORE_POIESIS).toTags("cfg")
                    .as("poi_core.include", "poi_core may include only core contract headers: {target}"),

            // Core Praxis
            DependencyEdge.from(CORE_PRAXIS).toTags("ida").except("ida_core.h")
                    .as("prx_core.include", "prx_core must not include feature ideas: {target}"),
            DependencyEdge.from(CORE_PRAXIS).toTags("prx", "poi").except("prx_core.h", "poi_core.h")
                    .as("prx_core.include", "prx_core must not include feature PRX/POI headers: {target}"),
            DependencyEdge.from(CORE_PRAXIS).toTags("hal", "bsp")
                    .as("prx_core.include", "prx_core must not include platform headers directly: {target}"),
            DependencyEdge.from(CORE_PRAXIS).toTags("cfg")
                    .as("prx_core.include", "prx_core may include only core contract headers: {target}"),

            // Praxis
            DependencyEdge.from(PRAXIS).toTags("ida")
                    .as("prx.include", "Praxis must not include Idea headers: {target}"),
            DependencyEdge.from(PRAXIS).toTags("prx").unless(SAME_FEATURE)
                    .as("prx.include", "Praxis must not include other features' Praxis: {target}"),
            DependencyEdge.from(PRAXIS).toTags("poi").unless(SAME_FEATURE)
                    .as("prx.include", "Praxis must not include other features' Poiesis: {target}"),
            DependencyEdge.from(PRAXIS).toTags("cfg").unless(PROJECT_SHARED, SAME_FEATURE)
                    .as("prx.include", "Praxis must not include other features' config: {target}"),
            DependencyEdge.from(PRAXIS).toTags("db").unless(PROJECT_SHARED, SAME_FEATURE)
                    .as("prx.include", "Praxis must not include other features' database headers: {target}"),

            // Poiesis
            DependencyEdge.from(POIESIS).toTags("ida")
                    .as("poi.include", "Poiesis must not include Idea headers: {target}"),
            DependencyEdge.from(POIESIS).toTags("prx")
                    .as("poi.include", "Poiesis must not include Praxis headers (no reverse dependency): {target}"),
            DependencyEdge.from(POIESIS).toTags("poi").unless(SAME_FEATURE)
                    .as("poi.include", "Poiesis must not include other features' Poiesis: {target}"),
            DependencyEdge.from(POIESIS).toTags("cfg").unless(PROJECT_SHARED, SAME_FEATURE)
                    .as("poi.include", "Poiesis must not include other features' config: {target}"),
            DependencyEdge.from(POIESIS).toTags("db").unless(PROJECT_SHARED, SAME_FEATURE)
                    .as("poi.include", "Poiesis must not include other features' database headers: {target}"),

            // Resources are leaves
            DependencyEdge.from(FEATURE_CONFIG, FEATURE_DATA, DATA_STREAM).toTags("ida", "prx", "poi")
                    .as("resource.include", "Resources must not include upper-layer headers: {target}"),

            // Modules
            DependencyEdge.from(SERVICE, MIDDLEWARE).toTags("ida", "prx", "poi")
                    .as("module.include", "Modules must not include upper-layer headers: {target}"),
            DependencyEdge.from(SERVICE, MIDDLEWARE).to(TargetSelector.projectResource())
                    .as("module.resource", "Modules must not include resources (cfg_/db_/stm_) directly: {target}"),

            // Platform: HAL -> BSP, never reversed
            DependencyEdge.from(BSP).toTags("hal")
                    .as("platform.direction", "BSP must not include HAL headers (direction is HAL -> BSP): {target}"),
            DependencyEdge.from(HAL, BSP)
                    .to(TargetSelector.tags("ida", "prx", "poi", "mdw", "svc").or(TargetSelector.projectResource()))
                    .as("platform.include", "Platform must not include upper-layer/resource/module headers: {target}")
    ));

    private static final DependencyGraph SYMBOL = new DependencyGraph(List.of(
            DependencyEdge.from(PRAXIS, CORE_PRAXIS).toTags("ida")
                    .as("prx_no-idea-ref", "Reverse dependency: prx_ references {target} (idea layer)"),
            DependencyEdge.from(POIESIS, CORE_POIESIS).toTags("ida")
                    .as("poi_no-idea-ref", "Reverse dependency: poi_ references {target} (idea layer)"),
            DependencyEdge.from(POIESIS, CORE_POIESIS).toTags("prx")
                    .as("poi_no-praxis-ref", "Reverse dependency: poi_ references {target} (praxis layer)")
    ));

    private final Map<Role, List<DependencyEdge>> edgesBySource;

    private DependencyGraph(List<DependencyEdge> edges) {
        var map = new EnumMap<Role, List<DependencyEdge>>(Role.class);
        for (DependencyEdge edge : edges) {
            for (Role source : edge.sources()) {
                map.computeIfAbsent(source, r -> new ArrayList<>()).add(edge);
            }
        }
        map.replaceAll((role, list) -> List.copyOf(list));
        this.edgesBySource = map;
    }

    /** Forbidden edges for {@code #include} references. */
    public static DependencyGraph includeGraph() {
        return INCLUDE;
    }

    /** Forbidden edges for bare class-name references (reverse layer dependencies). */
    public static DependencyGraph symbolGraph() {
        return SYMBOL;
    }

    public List<DependencyEdge> edgesFrom(Role source) {
        return edgesBySource.getOrDefault(source, List.of());
    }
}
