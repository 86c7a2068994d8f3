package com.comsect1.core.model;

/**
 * Architectural role of a source file, derived from its filename prefix.
 * <p>
 * The three Core roles are the cross-cutting contracts under {@code infra/bootstrap};
 * Idea, Praxis and Poiesis are their feature-scoped variants.
 */
public enum Role {
    CORE_IDEA("ida", Layer.IDEA),
    CORE_PRAXIS("prx", Layer.PRAXIS),
    CORE_POIESIS("poi", Layer.POIESIS),
    IDEA("ida", Layer.IDEA),
    PRAXIS("prx", Layer.PRAXIS),
    POIESIS("poi", Layer.POIESIS),
    FEATURE_CONFIG("cfg", Layer.RESOURCE),
    FEATURE_DATA("db", Layer.RESOURCE),
    DATA_STREAM("stm", Layer.RESOURCE),
    SERVICE("svc", Layer.MODULE),
    MIDDLEWARE("mdw", Layer.MODULE),
    HAL("hal", Layer.PLATFORM),
    BSP("bsp", Layer.PLATFORM),
    UNKNOWN(null, Layer.NONE),
    INVALID_PREFIX("inf", Layer.NONE);

    /** Coarse grouping used by the rule tables and the identifier binding. */
    public enum Layer { IDEA, PRAXIS, POIESIS, RESOURCE, MODULE, PLATFORM, NONE }

    private final String tag;
    private final Layer layer;

    Role(String tag, Layer layer) {
        this.tag = tag;
        this.layer = layer;
    }

    /** Filename tag without the trailing underscore, or {@code null} for {@link #UNKNOWN}. */
    public String tag() {
        return tag;
    }

    public Layer layer() {
        return layer;
    }

    public boolean isCore() {
        return this == CORE_IDEA || this == CORE_PRAXIS || this == CORE_POIESIS;
    }

    /** Idea, Praxis or Poiesis, core or feature-scoped. */
    public boolean isFeatureLayer() {
        return layer == Layer.IDEA || layer == Layer.PRAXIS || layer == Layer.POIESIS;
    }

    /** Roles whose files must belong to a feature folder. */
    public boolean isFeatureScoped() {
        return this == IDEA || this == PRAXIS || this == POIESIS
                || this == FEATURE_CONFIG || this == FEATURE_DATA;
    }

    public boolean isClassified() {
        return this != UNKNOWN && this != INVALID_PREFIX;
    }
}
