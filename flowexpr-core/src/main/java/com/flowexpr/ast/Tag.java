package com.flowexpr.ast;

/**
 * Syntactic construct named by an AST node.
 * Leaf tags carry a scalar value, the others an ordered list of children.
 */
public enum Tag {
    STR(true),
    NUM(true),
    VAR(true),
    OP(true),
    UNOP(false),
    PRODOP(false),
    SUMOP(false),
    COMPARE(false),
    LOGICAL(false),
    FUNC(false),
    ASSIGN(false),
    CALL(false),
    ARGS(false),
    GET(false),
    KEY(false),
    PAREN(false),
    LIST(false);

    private final boolean leaf;

    Tag(boolean leaf) {
        this.leaf = leaf;
    }

    public boolean isLeaf() {
        return leaf;
    }
}
