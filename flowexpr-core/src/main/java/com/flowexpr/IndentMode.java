package com.flowexpr;

/**
 * Layout used by {@link Unparser}.
 */
public enum IndentMode {
    /** Single line, minimal separators. */
    COMPACT,
    /** Call arguments and list elements one per line, nested bodies indented. */
    INDENTED
}
