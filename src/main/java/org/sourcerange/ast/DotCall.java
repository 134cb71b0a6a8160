package org.sourcerange.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A qualified call {@code receiver.member(args)}. Access syntax ({@code map[key]}), qualified
 * tuples ({@code Foo.{A, B}}) and interpolated atoms are represented as qualified calls on raw
 * module references ({@code Access.get}, {@code Foo.{}}, {@code :erlang.binary_to_atom}).
 *
 * @param meta The metadata; the position is that of the member identifier.
 * @param dot The dot holding receiver and member.
 * @param args The arguments.
 */
public record DotCall(Metadata meta, Dot dot, List<Node> args) implements Node {

    public DotCall {
        Objects.requireNonNull(meta, "meta");
        Objects.requireNonNull(dot, "dot");
        args = List.copyOf(args);
    }

    public boolean isAccess() {
        return dot.targets("Access", "get");
    }

    public boolean isQualifiedTuple() {
        return "{}".equals(dot.member());
    }

    public boolean isInterpolatedAtom() {
        return dot.targets("erlang", "binary_to_atom");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDotCall(this);
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(args.size() + 1);
        children.add(dot);
        children.addAll(args);
        return children;
    }

    @Override
    public String describe() {
        return "DotCall(" + (dot.member() == null ? "" : dot.member()) + "/" + args.size() + ")";
    }
}
