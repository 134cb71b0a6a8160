package org.sourcerange.ast;

import java.util.Objects;

/**
 * A string literal without interpolation. Heredocs are string literals with a triple-quote
 * delimiter.
 *
 * @param meta The metadata; the delimiter is required.
 * @param value The string contents, with escapes already resolved.
 */
public record StringLiteral(Metadata meta, String value) implements Node {

    public StringLiteral {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
