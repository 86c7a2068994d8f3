package com.comsect1.core.model;

/**
 * One line-level dependency mention inside a source file.
 *
 * @param target the include path, the class name, or the denylist rule id for
 *               {@link ReferenceKind#NAMESPACE_IMPORT} and {@link ReferenceKind#API_CALL}
 * @param leaf   last path segment of {@code target} (equal to it for non-include kinds)
 * @param line   1-based line number
 * @param raw    the source line without its trailing newline
 * @param kind   how the reference was detected
 */
public record Reference(
    String target,
    String leaf,
    int line,
    String raw,
    ReferenceKind kind
) {

    public static Reference include(String includePath, int line, String raw) {
        int slash = Math.max(includePath.lastIndexOf('/'), includePath.lastIndexOf('\\'));
        String leaf = slash >= 0 ? includePath.substring(slash + 1) : includePath;
        return new Reference(includePath, leaf, line, raw, ReferenceKind.INCLUDE);
    }

    public static Reference symbol(String className, int line, String raw) {
        return new Reference(className, className, line, raw, ReferenceKind.SYMBOL);
    }
}
