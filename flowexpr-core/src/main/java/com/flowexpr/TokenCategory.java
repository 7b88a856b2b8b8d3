package com.flowexpr;

/**
 * Lexical category of a token. The concrete symbol is its variant.
 */
public enum TokenCategory {
    OPERATOR,
    OPEN,
    CLOSE,
    SEP,
    STRING,
    SPACE,
    NUMBER,
    WORD,
    // Synthetic end-of-stream marker, never produced by a rule
    END
}
