package org.sourcerange.ast;

import java.util.List;
import java.util.Objects;

/**
 * A block of expressions. List and tuple literals are blocks too; they carry the position of
 * their closing bracket.
 *
 * @param meta The metadata.
 * @param args The expressions of the block.
 */
public record Block(Metadata meta, List<Node> args) implements Node {

    public Block {
        Objects.requireNonNull(meta, "meta");
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public List<Node> getChildren() {
        return args;
    }
}
