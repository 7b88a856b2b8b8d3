package com.flowexpr;

/**
 * Thrown when the current token is not valid at the current grammar position.
 */
public class ParseException extends FlowExprException {

    public enum Kind {
        /** Token that cannot start or continue an expression here. */
        UNEXPECTED_TOKEN,
        /** Reserved delimiter or operator without a grammar rule. */
        NOT_IMPLEMENTED,
        /** Input ended inside a collection or string literal. */
        UNEXPECTED_END,
        /** Tokens left over after a complete expression. */
        TRAILING_INPUT,
        /** Nesting exceeded {@link ParserOptions#maxDepth()}. */
        NESTING_TOO_DEEP
    }

    private final Kind kind;
    private final Token token;

    public ParseException(Kind kind, Token token, String message) {
        super(token != null ? message + " (" + token.describe() + ")" : message);
        this.kind = kind;
        this.token = token;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The offending token, or {@code null} when the error is not tied to one.
     */
    public Token token() {
        return token;
    }
}
