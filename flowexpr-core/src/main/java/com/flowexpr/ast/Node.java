package com.flowexpr.ast;

/**
 * Base interface for all expression AST nodes.
 *
 * <p>The tree is a tagged union: a node is either a {@link Leaf} holding a
 * literal value or a {@link Branch} holding its children. Nodes are immutable
 * and compare structurally.</p>
 */
public sealed interface Node permits Leaf, Branch {

    Tag tag();
}
