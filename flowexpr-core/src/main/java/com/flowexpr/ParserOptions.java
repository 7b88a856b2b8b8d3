package com.flowexpr;

/**
 * Parser settings.
 *
 * @param maxDepth         maximum nesting: collections, unary operators, binary operator
 *                         steps and postfix calls or indexes each add a level
 * @param requireFullInput whether tokens left after the top-level expression are an error;
 *                         when {@code false}, the default, the leading expression is returned
 *                         and the rest ignored
 */
public record ParserOptions(int maxDepth, boolean requireFullInput) {

    public static final int DEFAULT_MAX_DEPTH = 128;

    public static final ParserOptions DEFAULTS = new ParserOptions(DEFAULT_MAX_DEPTH, false);

    /** Defaults with trailing input rejected. */
    public static final ParserOptions STRICT = new ParserOptions(DEFAULT_MAX_DEPTH, true);

    public ParserOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
    }

    public ParserOptions withMaxDepth(int maxDepth) {
        return new ParserOptions(maxDepth, requireFullInput);
    }

    public ParserOptions withRequireFullInput(boolean requireFullInput) {
        return new ParserOptions(maxDepth, requireFullInput);
    }
}
