package org.sourcerange.ast;

import java.util.Objects;

/**
 * An integer or float literal. The rendered source text is kept in {@link Metadata#token()},
 * since the value alone does not tell how it was written ({@code 0x1F}, {@code 1_000}).
 *
 * @param meta The metadata.
 * @param value The numeric value.
 */
public record NumberLiteral(Metadata meta, Number value) implements Node {

    public NumberLiteral {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumberLiteral(this);
    }
}
