package com.comsect1.core.engine;

import com.comsect1.core.classify.RoleClassifier;
import com.comsect1.core.config.GateProperties;
import com.comsect1.core.extract.IncludeReferenceExtractor;
import com.comsect1.core.extract.ReferenceExtractor;
import com.comsect1.core.extract.SourceReadException;
import com.comsect1.core.layout.LayoutValidator;
import com.comsect1.core.layout.LocationValidator;
import com.comsect1.core.logging.GateMdc;
import com.comsect1.core.metrics.GateMetrics;
import com.comsect1.core.model.Binding;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.GateResult;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;
import com.comsect1.core.redflag.RedFlagHeuristics;
import com.comsect1.core.report.FindingAggregator;
import com.comsect1.core.rules.DependencyGraph;
import com.comsect1.core.rules.DependencyRuleEngine;
import com.comsect1.core.rules.RuleContext;
import com.comsect1.core.scanner.ArchitectureLayout;
import com.comsect1.core.scanner.SourceTreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Architecture gate for C-family trees whose files reference each other with {@code #include}.
 * <p>
 * Pipeline: layout checks, then per file classification, placement, include extraction,
 * role-graph evaluation and red-flag heuristics. Files are independent of each other once
 * the {@link RuleContext} is built, so they may be evaluated in parallel.
 */
@Service
public class IncludeGateEngine implements GateEngine {

    private static final Logger log = LoggerFactory.getLogger(IncludeGateEngine.class);

    public static final String READ_RULE = "read";

    private final GateProperties properties;
    private final SourceTreeScanner scanner;
    private final GateMetrics metrics;
    private final LayoutValidator layoutValidator;
    private final LocationValidator locationValidator;
    private final ReferenceExtractor extractor = new IncludeReferenceExtractor();
    private final DependencyRuleEngine ruleEngine = new DependencyRuleEngine(DependencyGraph.includeGraph());
    private final RedFlagHeuristics redFlags;

    public IncludeGateEngine(GateProperties properties, SourceTreeScanner scanner, GateMetrics metrics) {
        this.properties = properties;
        this.scanner = scanner;
        this.metrics = metrics;
        this.layoutValidator = new LayoutValidator(properties);
        this.locationValidator = new LocationValidator(properties);
        this.redFlags = new RedFlagHeuristics(properties.getEmptyIdeaThreshold());
    }

    @Override
    public Binding binding() {
        return Binding.INCLUDE;
    }

    @Override
    public GateResult run(Path root) {
        return run(root, SourceTreeScanner.normalizeExtensions(properties.getIncludeExtensions()));
    }

    @Override
    public GateResult run(Path root, Set<String> extensions) {
        long start = System.nanoTime();
        Path normalizedRoot = SourceTreeScanner.requireDirectory(root);
        GateMdc.setRun(binding(), normalizedRoot);
        try {
            log.info("Verifying include architecture under {}", normalizedRoot);
            var layout = new ArchitectureLayout(normalizedRoot);
            List<SourceFile> files = scanner.scan(normalizedRoot, extensions);

            var findings = new ArrayList<Finding>(layoutValidator.validate(layout, files.size()));
            RuleContext context = RuleContext.build(layout, files, properties, binding());
            Set<String> redFlagExtensions = SourceTreeScanner.normalizeExtensions(properties.getRedFlagSourceExtensions());

            Map<String, String> runContext = GateMdc.capture();
            var stream = properties.isParallel() ? files.parallelStream() : files.stream();
            findings.addAll(stream
                    .flatMap(file -> evaluateInContext(runContext, file, layout, context, redFlagExtensions).stream())
                    .toList());

            var result = new GateResult(binding(), normalizedRoot, files.size(), false,
                    FindingAggregator.aggregate(findings), Map.of());
            metrics.recordRun(result, Duration.ofNanos(System.nanoTime() - start));
            log.info("Include gate {}: {} file(s), {} error(s), {} warning(s)",
                    result.passed() ? "passed" : "failed", files.size(), result.errorCount(), result.warningCount());
            return result;
        } finally {
            GateMdc.clear();
        }
    }

    /** Evaluates one file with the run's MDC installed on whichever thread picks it up. */
    private List<Finding> evaluateInContext(Map<String, String> runContext, SourceFile file, ArchitectureLayout layout,
                                            RuleContext context, Set<String> redFlagExtensions) {
        Map<String, String> previous = GateMdc.capture();
        GateMdc.restore(runContext);
        try {
            return evaluate(file, layout, context, redFlagExtensions);
        } finally {
            GateMdc.restore(previous);
        }
    }

    private List<Finding> evaluate(SourceFile file, ArchitectureLayout layout, RuleContext context,
                                  Set<String> redFlagExtensions) {
        GateMdc.setFile(file.path());
        try {
            RoleAssignment assignment = RoleClassifier.classify(file.stem(), binding().caseSensitiveNames())
                    .withPathFeature(layout.featureFromPath(file.path()));
            var findings = new ArrayList<Finding>(locationValidator.validate(file, assignment, layout));

            if (redFlagExtensions.contains(file.extension())) {
                redFlags.evaluate(file, assignment).ifPresent(findings::add);
            }
            if (!assignment.role().isClassified()) {
                return findings;
            }

            List<Reference> references;
            try {
                references = extractor.extract(file);
            } catch (SourceReadException e) {
                log.warn("Could not read {}: {}", file.path(), e.getMessage());
                findings.add(Finding.error(file.displayPath(), 1, READ_RULE, e.getMessage()));
                return findings;
            }
            log.debug("{} classified as {} (feature {}), {} include(s)",
                    file.fileName(), assignment.role(), assignment.feature(), references.size());
            findings.addAll(ruleEngine.check(file, assignment, references, context));
            return findings;
        } finally {
            GateMdc.clearFile();
        }
    }
}
