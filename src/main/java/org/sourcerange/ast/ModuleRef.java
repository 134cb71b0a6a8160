package org.sourcerange.ast;

import java.util.Objects;

/**
 * A raw module or atom reference synthesized by the parser, e.g. {@code Access} in
 * {@code map[key]} or {@code :utf8} in an interpolated atom. It does not correspond to source
 * text and has no position.
 *
 * @param name The module or atom name.
 */
public record ModuleRef(String name) implements Node {

    public ModuleRef {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public Metadata meta() {
        return Metadata.EMPTY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitModuleRef(this);
    }

    @Override
    public String describe() {
        return "ModuleRef(" + name + ")";
    }
}
