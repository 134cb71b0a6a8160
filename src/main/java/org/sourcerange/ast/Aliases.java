package org.sourcerange.ast;

import java.util.List;
import java.util.Objects;

/**
 * A qualified module name such as {@code Foo.Bar.Baz}.
 * <p>
 * The path may start with an arbitrary expression instead of a name, as in
 * {@code __MODULE__.Nested} or {@code @module.Nested}; that expression is the {@code head}.
 *
 * @param meta The metadata; {@code last} marks the start of the final segment.
 * @param head The leading expression, or {@code null} when the path starts with a name.
 * @param segments The segment names following the head, in source order.
 */
public record Aliases(Metadata meta, Node head, List<String> segments) implements Node {

    public Aliases {
        Objects.requireNonNull(meta, "meta");
        segments = List.copyOf(segments);
    }

    public static Aliases of(Metadata meta, String... segments) {
        return new Aliases(meta, null, List.of(segments));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAliases(this);
    }

    @Override
    public List<Node> getChildren() {
        return head == null ? List.of() : List.of(head);
    }

    @Override
    public String describe() {
        return "Aliases(" + String.join(".", segments) + ")";
    }
}
