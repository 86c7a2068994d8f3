package com.comsect1.core.model;

/**
 * Source-ecosystem binding of the gate.
 */
public enum Binding {
    /** C-family sources referencing each other with {@code #include}. */
    INCLUDE("code", true),
    /** VB.NET / C# sources referencing each other by namespace import and symbol name. */
    IDENTIFIER("oop", false);

    private final String label;
    private final boolean caseSensitiveNames;

    Binding(String label, boolean caseSensitiveNames) {
        this.label = label;
        this.caseSensitiveNames = caseSensitiveNames;
    }

    public String label() {
        return label;
    }

    /** Whether role prefixes in file and header names must be lower case to be recognized. */
    public boolean caseSensitiveNames() {
        return caseSensitiveNames;
    }
}
