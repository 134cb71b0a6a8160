package org.sourcerange.ast;

import java.util.List;
import java.util.Objects;

/**
 * A key/value pair of a keyword list, e.g. {@code key: value}. Pairs carry no metadata of their
 * own; their span is derived from key and value.
 *
 * @param key The key.
 * @param value The value.
 */
public record Pair(Node key, Node value) implements Node {

    public Pair {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Metadata meta() {
        return Metadata.EMPTY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPair(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of(key, value);
    }
}
