package com.flowexpr.json;

import com.flowexpr.ast.Node;

/**
 * Writes expression trees as JSON documents.
 *
 * <p>A leaf becomes {@code {"tag": ..., "value": ...}} and a branch
 * {@code {"tag": ..., "children": [...]}}. Integral NUM values are written
 * without a fraction and doubles always with one, so reading the document
 * back yields the same numeric kinds.</p>
 */
public interface AstJsonSerializer {

    /**
     * Writes the tree on a single line.
     *
     * @throws AstJsonException if a value has no JSON form (NaN or infinite doubles)
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Writes the tree indented, one node per line.
     *
     * @throws AstJsonException if a value has no JSON form (NaN or infinite doubles)
     */
    String serializePretty(Node node) throws AstJsonException;
}
