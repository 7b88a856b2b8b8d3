package com.flowexpr;

/**
 * Thrown when no token rule matches at the current scan position.
 */
public class LexException extends FlowExprException {
    private final int line;
    private final int offset;
    private final String sourceLine;

    public LexException(int line, int offset, String sourceLine) {
        super(buildMessage(line, offset, sourceLine));
        this.line = line;
        this.offset = offset;
        this.sourceLine = sourceLine;
    }

    private static String buildMessage(int line, int offset, String sourceLine) {
        String found = offset < sourceLine.length()
            ? "'" + sourceLine.charAt(offset) + "'"
            : "end of line";
        return "No token matches " + found + " at line " + line + ", offset " + offset + ": " + sourceLine;
    }

    /** 1-based line number. */
    public int line() {
        return line;
    }

    /** 0-based offset within the line. */
    public int offset() {
        return offset;
    }

    public String sourceLine() {
        return sourceLine;
    }
}
