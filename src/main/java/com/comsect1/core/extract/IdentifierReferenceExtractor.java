package com.comsect1.core.extract;

import com.comsect1.core.model.Reference;
import com.comsect1.core.model.ReferenceKind;
import com.comsect1.core.model.SourceFile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Identifier-reference binding for VB.NET and C# sources.
 * <p>
 * Emits denylisted namespace imports and call fragments (see {@link ForbiddenApi}) and
 * whole-word occurrences of every known class name other than the file's own. Class names
 * are matched on word boundaries only; there is no symbol resolution, so a local identifier
 * that happens to equal a class name is reported as well.
 */
public class IdentifierReferenceExtractor implements ReferenceExtractor {

    private record ClassToken(String name, Pattern pattern) {}

    private final List<ClassToken> classTokens;

    /**
     * @param classNames class names of all role-classified files in the run
     */
    public IdentifierReferenceExtractor(Collection<String> classNames) {
        this.classTokens = classNames.stream()
                .distinct()
                .sorted()
                .map(name -> new ClassToken(name, Pattern.compile("\\b" + Pattern.quote(name) + "\\b")))
                .toList();
    }

    @Override
    public List<Reference> extract(SourceFile file) {
        List<String> lines = SourceLines.readLenient(file.path());
        var comments = CommentTracker.forExtension(file.extension());
        var references = new ArrayList<Reference>();
        String ownName = file.stem();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (comments.isCommentOrBlank(line)) {
                continue;
            }
            int lineNo = i + 1;
            for (ForbiddenApi api : ForbiddenApi.values()) {
                if (api.matches(line, file.extension())) {
                    ReferenceKind kind = api.isImport() ? ReferenceKind.NAMESPACE_IMPORT : ReferenceKind.API_CALL;
                    references.add(new Reference(api.ruleId(), api.ruleId(), lineNo, line, kind));
                }
            }
            for (ClassToken token : classTokens) {
                if (!token.name().equals(ownName) && token.pattern().matcher(line).find()) {
                    references.add(Reference.symbol(token.name(), lineNo, line));
                }
            }
        }
        return references;
    }
}
