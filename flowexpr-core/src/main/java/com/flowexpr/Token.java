package com.flowexpr;

import java.util.Locale;

/**
 * A classified span of one source line.
 *
 * @param category lexical category
 * @param variant  symbol within the category, e.g. {@code add} for {@code +}
 * @param text     matched source text
 * @param start    0-based offset of the first character within the line
 * @param end      0-based offset just past the last character
 * @param line     1-based line number
 */
public record Token(
    TokenCategory category,
    String variant,
    String text,
    int start,
    int end,
    int line
) {
    public static final String END_VARIANT = "end";

    public static Token endOfInput(int line, int offset) {
        return new Token(TokenCategory.END, END_VARIANT, "", offset, offset, line);
    }

    public boolean is(TokenCategory category) {
        return this.category == category;
    }

    public boolean is(TokenCategory category, String variant) {
        return this.category == category && this.variant.equals(variant);
    }

    public boolean isEnd() {
        return category == TokenCategory.END;
    }

    public boolean isSpace() {
        return category == TokenCategory.SPACE;
    }

    /**
     * Short human readable description used in error messages.
     */
    public String describe() {
        if (isEnd()) {
            return "end of input";
        }
        return category.name().toLowerCase(Locale.ROOT) + " '" + text + "' (" + variant + ") at line " + line + ", offset " + start;
    }
}
