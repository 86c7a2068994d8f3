package com.comsect1.core.rules;

import com.comsect1.core.classify.RoleClassifier;
import com.comsect1.core.config.GateProperties;
import com.comsect1.core.model.Binding;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.SourceFile;
import com.comsect1.core.scanner.ArchitectureLayout;
import com.comsect1.core.scanner.SourceTreeScanner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-only facts about the whole tree, computed once before per-file evaluation.
 *
 * @param layout                 the directory convention resolved against the root
 * @param headerOwnership        leaf name to owning features
 * @param coreContractHeader     leaf name of the shared Core contract, always referenceable
 * @param projectSharedHeaders   headers directly inside {@code project/config}
 * @param projectResourceHeaders cfg_/db_/stm_ headers living under features, config or datastreams
 * @param caseSensitiveNames     whether role tags in leaf names are matched case-sensitively
 */
public record RuleContext(
    ArchitectureLayout layout,
    HeaderOwnership headerOwnership,
    String coreContractHeader,
    Set<String> projectSharedHeaders,
    Set<String> projectResourceHeaders,
    boolean caseSensitiveNames
) {

    public static RuleContext build(ArchitectureLayout layout, Collection<SourceFile> files,
                                    GateProperties properties, Binding binding) {
        Set<String> headerExtensions = SourceTreeScanner.normalizeExtensions(properties.getHeaderExtensions());
        boolean caseSensitive = binding.caseSensitiveNames();
        return new RuleContext(
                layout,
                HeaderOwnership.build(files, headerExtensions, layout),
                properties.getCoreContractHeader(),
                Set.copyOf(listProjectConfigHeaders(layout.resolve(ArchitectureLayout.CONFIG))),
                Set.copyOf(collectProjectResourceHeaders(layout, files, headerExtensions, caseSensitive)),
                caseSensitive
        );
    }

    public boolean isCoreContract(String leaf) {
        return coreContractHeader.equalsIgnoreCase(leaf);
    }

    public boolean isProjectShared(String leaf) {
        return projectSharedHeaders.contains(leaf);
    }

    public boolean isProjectResource(String leaf) {
        return projectResourceHeaders.contains(leaf);
    }

    /**
     * Whether {@code leaf} belongs to {@code feature}: through the ownership map when the
     * leaf is owned by any feature folder, otherwise by its {@code <tag>_<feature>} name.
     */
    public boolean isSameFeature(String leaf, String feature) {
        if (feature == null) {
            return false;
        }
        if (headerOwnership.isOwned(leaf)) {
            return headerOwnership.ownersOf(leaf).contains(feature);
        }
        String tag = RoleClassifier.tagOf(leaf, caseSensitiveNames);
        if (tag == null) {
            return false;
        }
        int dot = leaf.lastIndexOf('.');
        String stem = (dot > 0 ? leaf.substring(0, dot) : leaf).toLowerCase(Locale.ROOT);
        String base = (tag + "_" + feature).toLowerCase(Locale.ROOT);
        return stem.equals(base) || stem.startsWith(base + "_");
    }

    private static List<String> listProjectConfigHeaders(Path configDir) {
        if (!Files.isDirectory(configDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(configDir)) {
            return entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(".h"))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Set<String> collectProjectResourceHeaders(ArchitectureLayout layout, Collection<SourceFile> files,
                                                             Set<String> headerExtensions,
                                                             boolean caseSensitive) {
        var names = new HashSet<String>();
        for (SourceFile file : files) {
            if (!headerExtensions.contains(file.extension())) {
                continue;
            }
            Role role = RoleClassifier.classify(file.stem(), caseSensitive).role();
            if (role != Role.FEATURE_CONFIG && role != Role.FEATURE_DATA && role != Role.DATA_STREAM) {
                continue;
            }
            Path path = file.path();
            if (layout.isUnderAny(path, ArchitectureLayout.FEATURES)
                    || layout.isUnderAny(path, ArchitectureLayout.CONFIG)
                    || layout.isUnderAny(path, ArchitectureLayout.DATASTREAMS)) {
                names.add(file.fileName());
            }
        }
        return names;
    }
}
