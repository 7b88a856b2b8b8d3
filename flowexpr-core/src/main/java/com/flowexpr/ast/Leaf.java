package com.flowexpr.ast;

import java.util.Objects;

/**
 * Node holding a scalar: a {@link String} for STR, VAR and OP, a {@link Number} for NUM.
 */
public record Leaf(Tag tag, Object value) implements Node {

    public Leaf {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(value, "value");
        if (!tag.isLeaf()) {
            throw new IllegalArgumentException(tag + " is not a leaf tag");
        }
        if (tag == Tag.NUM) {
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("NUM value must be a Number, got " + value.getClass().getSimpleName());
            }
            // Widen to Long / Double
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = ((Number) value).longValue();
            } else if (value instanceof Float f) {
                value = f.doubleValue();
            }
        } else if (!(value instanceof String)) {
            throw new IllegalArgumentException(tag + " value must be a String, got " + value.getClass().getSimpleName());
        }
    }

    public static Leaf str(String value) {
        return new Leaf(Tag.STR, value);
    }

    public static Leaf num(Number value) {
        return new Leaf(Tag.NUM, value);
    }

    public static Leaf var(String name) {
        return new Leaf(Tag.VAR, name);
    }

    public static Leaf op(String operator) {
        return new Leaf(Tag.OP, operator);
    }

    /**
     * Returns the value as text. Only meaningful for STR, VAR and OP leaves.
     */
    public String text() {
        return value instanceof String s ? s : String.valueOf(value);
    }

    @Override
    public String toString() {
        return tag + "(" + value + ")";
    }
}
