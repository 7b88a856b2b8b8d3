package com.flowexpr.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Interior node: a tag plus an ordered, immutable list of children.
 */
public record Branch(Tag tag, List<Node> children) implements Node {

    public Branch {
        Objects.requireNonNull(tag, "tag");
        if (tag.isLeaf()) {
            throw new IllegalArgumentException(tag + " is a leaf tag");
        }
        children = List.copyOf(children);
    }

    public static Branch of(Tag tag, Node... children) {
        return new Branch(tag, List.of(children));
    }

    public Node child(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    @Override
    public String toString() {
        return children.stream()
            .map(Node::toString)
            .collect(Collectors.joining(", ", tag + "(", ")"));
    }
}
