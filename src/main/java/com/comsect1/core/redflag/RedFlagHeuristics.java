package com.comsect1.core.redflag;

import com.comsect1.core.extract.CommentTracker;
import com.comsect1.core.extract.SourceLines;
import com.comsect1.core.extract.SourceReadException;
import com.comsect1.core.model.Finding;
import com.comsect1.core.model.Role;
import com.comsect1.core.model.RoleAssignment;
import com.comsect1.core.model.SourceFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Advisory structural heuristics. Both produce warnings only and never fail the gate.
 * <ul>
 *   <li><b>Empty Idea</b>: an Idea file with fewer code lines than the threshold is
 *       probably a pass-through without domain judgment.</li>
 *   <li><b>Fat Poiesis</b>: a Poiesis file branching on a domain-meaningful condition
 *       probably holds business logic.</li>
 * </ul>
 * Feature Idea and Poiesis files are always checked; {@code ida_core} and {@code poi_core}
 * only when the heuristics are created with {@code includeCoreFiles}.
 */
public class RedFlagHeuristics {

    private static final Logger log = LoggerFactory.getLogger(RedFlagHeuristics.class);

    public static final String EMPTY_IDEA = "red-flag-empty-idea";
    public static final String FAT_POIESIS = "red-flag-fat-poiesis";

    private static final Pattern DOMAIN_CONDITIONAL = Pattern.compile(
            "\\b(?:if|switch|case)\\b.*\\b(?:mode|state|status|level|type|flag|enable|disable|active|threshold)\\b",
            Pattern.CASE_INSENSITIVE);

    private final int emptyIdeaThreshold;
    private final boolean includeCoreFiles;

    public RedFlagHeuristics(int emptyIdeaThreshold) {
        this(emptyIdeaThreshold, false);
    }

    public RedFlagHeuristics(int emptyIdeaThreshold, boolean includeCoreFiles) {
        this.emptyIdeaThreshold = emptyIdeaThreshold;
        this.includeCoreFiles = includeCoreFiles;
    }

    /**
     * Evaluates the heuristic matching the file's role. Unreadable files yield no warning;
     * read failures are reported by the reference extractors.
     */
    public Optional<Finding> evaluate(SourceFile file, RoleAssignment assignment) {
        Role role = assignment.role();
        try {
            if (role == Role.IDEA || (includeCoreFiles && role == Role.CORE_IDEA)) {
                return emptyIdea(file);
            }
            if (role == Role.POIESIS || (includeCoreFiles && role == Role.CORE_POIESIS)) {
                return fatPoiesis(file);
            }
        } catch (SourceReadException e) {
            log.debug("Skipping red-flag heuristics for unreadable {}: {}", file.path(), e.getMessage());
            return Optional.empty();
        }
        return Optional.empty();
    }

    Optional<Finding> emptyIdea(SourceFile file) {
        int codeLines = countCodeLines(file);
        if (codeLines >= emptyIdeaThreshold) {
            return Optional.empty();
        }
        return Optional.of(Finding.warning(file.displayPath(), 0, EMPTY_IDEA,
                "Possible Empty Idea: only " + codeLines + " code line(s) (threshold: " + emptyIdeaThreshold
                        + "). Verify that domain judgment is present, not just pass-through calls."));
    }

    Optional<Finding> fatPoiesis(SourceFile file) {
        List<String> lines = SourceLines.readLenient(file.path());
        var comments = CommentTracker.forExtension(file.extension());
        int firstLine = 0;
        int hits = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (comments.isCommentOrBlank(line)) {
                continue;
            }
            if (DOMAIN_CONDITIONAL.matcher(line).find()) {
                hits++;
                if (firstLine == 0) {
                    firstLine = i + 1;
                }
            }
        }
        if (hits == 0) {
            return Optional.empty();
        }
        return Optional.of(Finding.warning(file.displayPath(), firstLine, FAT_POIESIS,
                "Possible Fat Poiesis: " + hits + " domain-meaningful conditional(s) in poi_ file. "
                        + "Consider moving business logic to ida_ or prx_."));
    }

    /**
     * Non-blank lines that are neither comments (line or block) nor directives.
     */
    public static int countCodeLines(SourceFile file) {
        var comments = CommentTracker.forExtension(file.extension());
        int count = 0;
        for (String line : SourceLines.readLenient(file.path())) {
            if (comments.isCommentOrBlank(line) || CommentTracker.isDirective(line)) {
                continue;
            }
            count++;
        }
        return count;
    }
}
