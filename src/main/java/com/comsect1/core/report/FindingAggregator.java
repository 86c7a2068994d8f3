package com.comsect1.core.report;

import com.comsect1.core.model.Finding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Sorts findings into report order and drops duplicates sharing the same
 * (file, line, rule) key, keeping the first one.
 */
public final class FindingAggregator {

    private record Key(String file, int line, String rule) {}

    private FindingAggregator() {
        // utility class
    }

    public static List<Finding> aggregate(Collection<Finding> findings) {
        var sorted = new ArrayList<>(findings);
        sorted.removeIf(Objects::isNull);
        sorted.sort(Finding.REPORT_ORDER);

        var seen = new HashSet<Key>();
        var unique = new ArrayList<Finding>(sorted.size());
        for (Finding f : sorted) {
            if (seen.add(new Key(f.file(), f.line(), f.rule()))) {
                unique.add(f);
            }
        }
        return List.copyOf(unique);
    }
}
