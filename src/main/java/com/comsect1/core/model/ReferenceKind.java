package com.comsect1.core.model;

/**
 * How a {@link Reference} was detected.
 */
public enum ReferenceKind {
    INCLUDE,           // textual include directive
    NAMESPACE_IMPORT,  // Imports / using statement on the denylist
    API_CALL,          // denylisted call fragment
    SYMBOL             // bare whole-word class name occurrence
}
