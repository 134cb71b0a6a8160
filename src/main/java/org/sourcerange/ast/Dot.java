package org.sourcerange.ast;

import java.util.List;
import java.util.Objects;

/**
 * The dot of a qualified call: {@code receiver.member}. An anonymous function call
 * ({@code fun.(x)}) has no member.
 *
 * @param meta The metadata.
 * @param receiver The expression left of the dot.
 * @param member The called name, or {@code null} for an anonymous call.
 */
public record Dot(Metadata meta, Node receiver, String member) implements Node {

    public Dot {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(receiver, "receiver");
    }

    public boolean isAnonymous() {
        return member == null;
    }

    /**
     * Whether this dot calls {@code function} on the raw module reference {@code module}.
     */
    public boolean targets(String module, String function) {
        return receiver instanceof ModuleRef ref && ref.name().equals(module) && function.equals(member);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDot(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of(receiver);
    }

    @Override
    public String describe() {
        return "Dot(" + (member == null ? "" : member) + ")";
    }
}
