package com.comsect1.core.classify;

import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a filename stem to its architectural {@link Role}.
 * <p>
 * Matching order, first hit wins:
 * <ol>
 *   <li>the reserved {@code inf_} prefix is always {@link Role#INVALID_PREFIX}</li>
 *   <li>{@code ida_core}, {@code prx_core} and {@code poi_core} are the Core roles</li>
 *   <li>{@code ida_|prx_|poi_|cfg_|db_<feature>} are feature-scoped roles</li>
 *   <li>{@code svc_}, {@code mdw_}, {@code hal_}, {@code bsp_}, {@code stm_} are infrastructure roles</li>
 *   <li>anything else is {@link Role#UNKNOWN}</li>
 * </ol>
 * Tags match case-insensitively unless a case-sensitive lookup is requested, as the
 * include binding does; the implied feature keeps its original case in both modes.
 * The classifier is stateless and never touches the file system.
 */
public final class RoleClassifier {

    public static final String CORE_FEATURE = "core";

    private static final String RESERVED_PREFIX = "inf_";

    private static final Map<String, Role> CORE_NAMES = Map.of(
            "ida_core", Role.CORE_IDEA,
            "prx_core", Role.CORE_PRAXIS,
            "poi_core", Role.CORE_POIESIS
    );

    private static final String FEATURE_ROLE_REGEX = "^(?<tag>ida|prx|poi|cfg|db)_(?<feature>.+)$";

    private static final Pattern FEATURE_ROLE = Pattern.compile(FEATURE_ROLE_REGEX, Pattern.CASE_INSENSITIVE);

    private static final Pattern FEATURE_ROLE_EXACT = Pattern.compile(FEATURE_ROLE_REGEX);

    private static final Map<String, Role> FEATURE_TAGS = Map.of(
            "ida", Role.IDEA,
            "prx", Role.PRAXIS,
            "poi", Role.POIESIS,
            "cfg", Role.FEATURE_CONFIG,
            "db", Role.FEATURE_DATA
    );

    private static final Map<String, Role> INFRA_PREFIXES = Map.of(
            "svc_", Role.SERVICE,
            "mdw_", Role.MIDDLEWARE,
            "hal_", Role.HAL,
            "bsp_", Role.BSP,
            "stm_", Role.DATA_STREAM
    );

    private RoleClassifier() {
        // utility class
    }

    public static RoleAssignment classify(String stem) {
        return classify(stem, false);
    }

    /**
     * Classifies a stem.
     *
     * @param stem          filename without its extension
     * @param caseSensitive when {@code true}, {@code IDA_motor} is not an Idea stem
     */
    public static RoleAssignment classify(String stem, boolean caseSensitive) {
        if (stem == null) {
            return RoleAssignment.of(Role.UNKNOWN);
        }
        String key = caseSensitive ? stem : stem.toLowerCase(Locale.ROOT);

        if (key.startsWith(RESERVED_PREFIX)) {
            return RoleAssignment.of(Role.INVALID_PREFIX);
        }

        Role core = CORE_NAMES.get(key);
        if (core != null) {
            return new RoleAssignment(core, CORE_FEATURE);
        }

        Matcher m = (caseSensitive ? FEATURE_ROLE_EXACT : FEATURE_ROLE).matcher(stem);
        if (m.matches()) {
            Role role = FEATURE_TAGS.get(m.group("tag").toLowerCase(Locale.ROOT));
            return new RoleAssignment(role, m.group("feature"));
        }

        for (var entry : INFRA_PREFIXES.entrySet()) {
            if (key.startsWith(entry.getKey())) {
                return RoleAssignment.of(entry.getValue());
            }
        }
        return RoleAssignment.of(Role.UNKNOWN);
    }

    /** Classifies a filename, stripping the last extension first. */
    public static RoleAssignment classifyFileName(String fileName) {
        return classifyFileName(fileName, false);
    }

    public static RoleAssignment classifyFileName(String fileName, boolean caseSensitive) {
        int dot = fileName.lastIndexOf('.');
        return classify(dot > 0 ? fileName.substring(0, dot) : fileName, caseSensitive);
    }

    /**
     * Returns the lower-case role tag a leaf name starts with ({@code "prx"} for
     * {@code prx_motor.h}), or {@code null} when the leaf carries no known tag.
     */
    public static String tagOf(String leaf) {
        return tagOf(leaf, false);
    }

    public static String tagOf(String leaf, boolean caseSensitive) {
        Role role = classifyFileName(leaf, caseSensitive).role();
        return role.isClassified() ? role.tag() : null;
    }
}
