package com.flowexpr.json;

import com.flowexpr.ast.Node;

/**
 * Reads expression trees from the JSON documents {@link AstJsonSerializer} writes.
 *
 * <p>Documents are validated while reading: unknown tags, leaves without a value
 * of the right type, branches without a children array and negative NUM values
 * are rejected with an {@link AstJsonException} whose {@link AstJsonException#path()}
 * names the offending node.</p>
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to an expression tree.
     *
     * @param json the JSON string to deserialize
     * @return the root node
     * @throws AstJsonException if the JSON is malformed or does not describe a valid tree
     */
    Node deserializeExpression(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific node shape.
     *
     * @param json the JSON string to deserialize
     * @param type {@code Leaf}, {@code Branch} or {@code Node}
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails or the node has another shape
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
