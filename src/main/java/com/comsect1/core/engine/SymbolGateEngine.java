package com.comsect1.core.engine;

import com.comsect1.core.classify.RoleClassifier;
import com.comsect1.core.config.GateProperties;
import com.comsect1.core.extract.IdentifierReferenceExtractor;
import com.comsect1.core.extract.SourceReadException;
import com.comsect1.core.logging.GateMdc;
import com.comsect1.core.metrics.GateMetrics;
import com.comsect1.core.model.Binding;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.GateResult;
import com.comsect1.core.model.Reference;
import com.comsect1.core.model.ReferenceKind;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;
import com.comsect1.core.redflag.RedFlagHeuristics;
import com.comsect1.core.report.FindingAggregator;
import com.comsect1.core.rules.CrossFeatureIsolationCheck;
import com.comsect1.core.rules.DependencyGraph;
import com.comsect1.core.rules.DependencyRuleEngine;
import com.comsect1.core.rules.ForbiddenApiCheck;
import com.comsect1.core.rules.RuleContext;
import com.comsect1.core.scanner.ArchitectureLayout;
import com.comsect1.core.scanner.SourceTreeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Architecture gate for object-oriented trees (VB.NET, C#) where cross-file references are
 * bare class names rather than include directives.
 * <p>
 * Only Idea, Praxis and Poiesis files are evaluated. A tree without any of them is a no-op.
 */
@Service
public class SymbolGateEngine implements GateEngine {

    private static final Logger log = LoggerFactory.getLogger(SymbolGateEngine.class);

    public static final String READ_RULE = "file-read-error";

    private record LayerFile(SourceFile file, RoleAssignment assignment) {}

    private final GateProperties properties;
    private final SourceTreeScanner scanner;
    private final GateMetrics metrics;
    private final ForbiddenApiCheck forbiddenApiCheck = new ForbiddenApiCheck();
    private final DependencyRuleEngine ruleEngine = new DependencyRuleEngine(DependencyGraph.symbolGraph());
    private final RedFlagHeuristics redFlags;

    public SymbolGateEngine(GateProperties properties, SourceTreeScanner scanner, GateMetrics metrics) {
        this.properties = properties;
        this.scanner = scanner;
        this.metrics = metrics;
        this.redFlags = new RedFlagHeuristics(properties.getEmptyIdeaThreshold(), true);
    }

    @Override
    public Binding binding() {
        return Binding.IDENTIFIER;
    }

    @Override
    public GateResult run(Path root) {
        return run(root, SourceTreeScanner.normalizeExtensions(properties.getSymbolExtensions()));
    }

    @Override
    public GateResult run(Path root, Set<String> extensions) {
        long start = System.nanoTime();
        Path normalizedRoot = SourceTreeScanner.requireDirectory(root);
        GateMdc.setRun(binding(), normalizedRoot);
        try {
            log.info("Verifying identifier architecture under {}", normalizedRoot);
            var layout = new ArchitectureLayout(normalizedRoot);
            List<SourceFile> files = scanner.scan(normalizedRoot, extensions);
            boolean caseSensitive = binding().caseSensitiveNames();
            List<LayerFile> layerFiles = files.stream()
                    .map(file -> new LayerFile(file, RoleClassifier.classify(file.stem(), caseSensitive)
                            .withPathFeature(layout.featureFromPath(file.path()))))
                    .filter(lf -> lf.assignment().role().isFeatureLayer())
                    .toList();

            GateResult result;
            if (layerFiles.isEmpty()) {
                log.info("No ida_/prx_/poi_ files found under {}", normalizedRoot);
                result = new GateResult(binding(), normalizedRoot, 0, true, List.of(), counters(layerFiles));
            } else {
                result = evaluate(normalizedRoot, layout, files, layerFiles);
            }
            metrics.recordRun(result, Duration.ofNanos(System.nanoTime() - start));
            log.info("Identifier gate {}: {} layer file(s), {} error(s), {} warning(s)",
                    result.noOp() ? "skipped" : result.passed() ? "passed" : "failed",
                    result.filesScanned(), result.errorCount(), result.warningCount());
            return result;
        } finally {
            GateMdc.clear();
        }
    }

    private GateResult evaluate(Path root, ArchitectureLayout layout, List<SourceFile> files,
                                List<LayerFile> layerFiles) {
        var featureByClassName = new LinkedHashMap<String, String>();
        for (LayerFile lf : layerFiles) {
            if (lf.assignment().feature() != null) {
                featureByClassName.putIfAbsent(lf.file().stem(), lf.assignment().feature());
            }
        }
        var extractor = new IdentifierReferenceExtractor(layerFiles.stream().map(lf -> lf.file().stem()).toList());
        var crossFeatureCheck = new CrossFeatureIsolationCheck(featureByClassName);
        RuleContext context = RuleContext.build(layout, files, properties, binding());

        var findings = new ArrayList<Finding>();
        for (LayerFile lf : layerFiles) {
            SourceFile file = lf.file();
            RoleAssignment assignment = lf.assignment();
            GateMdc.setFile(file.path());
            try {
                List<Reference> references;
                try {
                    references = extractor.extract(file);
                } catch (SourceReadException e) {
                    log.warn("Could not read {}: {}", file.path(), e.getMessage());
                    findings.add(Finding.error(file.displayPath(), 0, READ_RULE, e.getMessage()));
                    continue;
                }
                List<Reference> symbols = references.stream()
                        .filter(ref -> ref.kind() == ReferenceKind.SYMBOL)
                        .toList();
                findings.addAll(forbiddenApiCheck.check(file, assignment, references));
                findings.addAll(ruleEngine.check(file, assignment, symbols, context));
                findings.addAll(crossFeatureCheck.check(file, assignment, symbols));
                redFlags.evaluate(file, assignment).ifPresent(findings::add);
            } finally {
                GateMdc.clearFile();
            }
        }
        return new GateResult(binding(), root, layerFiles.size(), false,
                FindingAggregator.aggregate(findings), counters(layerFiles));
    }

    private static Map<String, Integer> counters(List<LayerFile> layerFiles) {
        var counters = new LinkedHashMap<String, Integer>();
        counters.put("ideaFilesChecked", count(layerFiles, Role.Layer.IDEA));
        counters.put("praxisFilesChecked", count(layerFiles, Role.Layer.PRAXIS));
        counters.put("poiesisFilesChecked", count(layerFiles, Role.Layer.POIESIS));
        return counters;
    }

    private static int count(List<LayerFile> layerFiles, Role.Layer layer) {
        return (int) layerFiles.stream().filter(lf -> lf.assignment().role().layer() == layer).count();
    }
}
