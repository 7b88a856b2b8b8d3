package com.flowexpr.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = FlowExprJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(node);
 * Node node = mapper.readValue(json, Node.class);
 * </pre>
 */
public final class FlowExprJackson {

    private FlowExprJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Writes leaves as {"tag", "value"} and branches as {"tag", "children"}
     * - Reads any node shape through {@code Node.class}, {@code Leaf.class} or {@code Branch.class}
     * - Keeps the kind of numeric literals (integral vs. floating point) across a round trip
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
