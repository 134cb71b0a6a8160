package org.sourcerange.ast;

import java.util.Objects;

/**
 * A raw piece of literal text inside an interpolation or sigil body. It carries no position of
 * its own; its extent is derived while walking the enclosing literal.
 *
 * @param value The text.
 */
public record Text(String value) implements Node {

    public Text {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Metadata meta() {
        return Metadata.EMPTY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
