package org.sourcerange.ast;

import java.util.Objects;

/**
 * A variable reference.
 *
 * @param meta The metadata.
 * @param name The variable name.
 * @param context The context the variable belongs to, or {@code null} for the default context.
 */
public record Variable(Metadata meta, String name, String context) implements Node {

    public Variable {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String describe() {
        return "Variable(" + name + ")";
    }
}
