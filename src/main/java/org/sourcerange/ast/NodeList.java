package org.sourcerange.ast;

import java.util.List;

/**
 * A bare sequence of nodes. Lists written in the source are {@link Block}s; a bare sequence only
 * occurs as the tail of a partial keyword list ({@code [:a, b: c]}) or as the argument list of a
 * stab clause ({@code a, b -> c}).
 *
 * @param elements The nodes, in source order.
 */
public record NodeList(List<Node> elements) implements Node {

    public NodeList {
        elements = List.copyOf(elements);
    }

    public static NodeList of(Node... elements) {
        return new NodeList(List.of(elements));
    }

    @Override
    public Metadata meta() {
        return Metadata.EMPTY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNodeList(this);
    }

    @Override
    public List<Node> getChildren() {
        return elements;
    }
}
