package com.comsect1.core.extract;

/**
 * Line-oriented comment detection for C-family, C# and VB sources.
 * <p>
 * Stateful across lines so that {@code /* ... *}{@code /} blocks spanning several lines are
 * recognized; create one tracker per file. This is a textual approximation: comment
 * markers inside string literals are not special-cased.
 */
public final class CommentTracker {

    private final boolean apostropheComments;
    private boolean inBlock;

    private CommentTracker(boolean apostropheComments) {
        this.apostropheComments = apostropheComments;
    }

    public static CommentTracker cFamily() {
        return new CommentTracker(false);
    }

    /** VB treats a leading apostrophe as a comment; C-family languages do not. */
    public static CommentTracker forExtension(String extension) {
        return new CommentTracker(".vb".equalsIgnoreCase(extension));
    }

    /**
     * Returns {@code true} when the line is blank, a comment line, or part of a block comment.
     * Lines with code before a trailing comment are not comments.
     */
    public boolean isCommentOrBlank(String line) {
        String stripped = line.strip();
        if (inBlock) {
            if (stripped.contains("*/")) {
                inBlock = false;
            }
            return true;
        }
        if (stripped.isEmpty()) {
            return true;
        }
        if (stripped.startsWith("/*")) {
            inBlock = !stripped.substring(2).contains("*/");
            return true;
        }
        return stripped.startsWith("//")
                || (apostropheComments && stripped.startsWith("'"))
                || stripped.startsWith("*")
                || stripped.startsWith("*/");
    }

    /** Preprocessor or compiler directive ({@code #include}, {@code #Region}, ...). */
    public static boolean isDirective(String line) {
        return line.strip().startsWith("#");
    }
}
