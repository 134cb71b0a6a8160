package org.sourcerange.ast;

import java.util.Objects;

/**
 * An atom literal such as {@code :ok} or {@code :"quoted atom"}.
 *
 * @param meta The metadata; a delimiter is present only for quoted atoms.
 * @param name The atom name, without the leading colon and quotes.
 */
public record AtomLiteral(Metadata meta, String name) implements Node {

    public AtomLiteral {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAtomLiteral(this);
    }

    @Override
    public String describe() {
        return "AtomLiteral(:" + name + ")";
    }
}
