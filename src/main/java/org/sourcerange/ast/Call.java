package org.sourcerange.ast;

import java.util.List;
import java.util.Objects;

/**
 * An unqualified call. Operators ({@code +}, {@code not}, {@code ::}), stab clauses
 * ({@code ->}), stepped ranges ({@code ..//}), bitstrings and interpolations ({@code <<>>})
 * are calls too; their name is the operator tag.
 *
 * @param meta The metadata.
 * @param name The called name or operator tag.
 * @param args The arguments.
 */
public record Call(Metadata meta, String name, List<Node> args) implements Node {

    public Call {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }

    public static Call of(Metadata meta, String name, Node... args) {
        return new Call(meta, name, List.of(args));
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<Node> getChildren() {
        return args;
    }

    @Override
    public String describe() {
        return "Call(" + name + "/" + args.size() + ")";
    }
}
