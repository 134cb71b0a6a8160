package org.sourcerange.ast;

import java.util.List;
import java.util.Objects;

/**
 * A sigil such as {@code ~r/foo/i}: a prefix, an interpolated body and trailing modifier letters.
 *
 * @param meta The metadata; the delimiter is required.
 * @param name The sigil name following the tilde, e.g. {@code r}.
 * @param body The body, a {@code <<>>} call whose arguments are the interpolation segments.
 * @param modifiers The modifier letters, possibly empty.
 */
public record Sigil(Metadata meta, String name, Call body, String modifiers) implements Node {

    public Sigil {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        modifiers = modifiers == null ? "" : modifiers;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSigil(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of(body);
    }

    @Override
    public String describe() {
        return "Sigil(~" + name + ")";
    }
}
