package com.comsect1.core.extract;

import com.comsect1.core.model.Reference;
import com.comsect1.core.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual-include binding: {@code #include "x.h"} and {@code #include <x.h>} directives.
 * <p>
 * Angle-bracket (system library) includes are dropped; only quoted project includes
 * reach the rule engine.
 */
public class IncludeReferenceExtractor implements ReferenceExtractor {

    private static final Pattern INCLUDE = Pattern.compile("^\\s*#\\s*include\\s*[<\"](?<path>[^\">]+)[\">]");
    private static final Pattern SYSTEM_INCLUDE = Pattern.compile("^\\s*#\\s*include\\s*<");

    @Override
    public List<Reference> extract(SourceFile file) {
        List<String> lines = SourceLines.readStrict(file.path());
        var comments = CommentTracker.cFamily();
        var references = new ArrayList<Reference>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (comments.isCommentOrBlank(line)) {
                continue;
            }
            Matcher m = INCLUDE.matcher(line);
            if (!m.find() || SYSTEM_INCLUDE.matcher(line).find()) {
                continue;
            }
            references.add(Reference.include(m.group("path"), i + 1, line));
        }
        return references;
    }
}
