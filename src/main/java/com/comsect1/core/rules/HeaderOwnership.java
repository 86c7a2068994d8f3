package com.comsect1.core.rules;

import com.comsect1.core.model.SourceFile;
import com.comsect1.core.scanner.ArchitectureLayout;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which features define a header with a given leaf name under their own feature folder.
 * <p>
 * Several features (or nested dependency units) may legitimately ship a header with
 * the same leaf name; a reference to it counts as same-feature only for the features
 * listed as owners.
 */
public final class HeaderOwnership {

    private final Map<String, Set<String>> owners;

    private HeaderOwnership(Map<String, Set<String>> owners) {
        this.owners = owners;
    }

    public static HeaderOwnership build(Collection<SourceFile> files, Set<String> headerExtensions,
                                        ArchitectureLayout layout) {
        var map = new HashMap<String, Set<String>>();
        for (SourceFile file : files) {
            if (!headerExtensions.contains(file.extension())) {
                continue;
            }
            String feature = layout.featureFromPath(file.path());
            if (feature != null) {
                map.computeIfAbsent(file.fileName(), k -> new TreeSet<>()).add(feature);
            }
        }
        map.replaceAll((k, v) -> Set.copyOf(v));
        return new HeaderOwnership(Map.copyOf(map));
    }

    public boolean isOwned(String leaf) {
        return owners.containsKey(leaf);
    }

    public Set<String> ownersOf(String leaf) {
        return owners.getOrDefault(leaf, Set.of());
    }
}
