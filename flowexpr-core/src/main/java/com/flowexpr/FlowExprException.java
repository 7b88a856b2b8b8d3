package com.flowexpr;

/**
 * Base class of every error raised while tokenizing or parsing an expression.
 * Either kind is terminal for the call that raised it.
 */
public class FlowExprException extends RuntimeException {

    public FlowExprException(String message) {
        super(message);
    }

    public FlowExprException(String message, Throwable cause) {
        super(message, cause);
    }
}
