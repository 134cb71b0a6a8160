package org.sourcerange.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of a parsed syntax tree.
 * <p>
 * The set of shapes is closed: every consumer dispatches through {@link NodeVisitor}, so adding a
 * shape forces every dispatch to handle it. Nodes are immutable and own their children.
 */
public sealed interface Node
        permits NumberLiteral, StringLiteral, AtomLiteral, Block, Variable, Aliases, Pair, NodeList,
                Call, Sigil, Dot, DotCall, Text, ModuleRef {

    /**
     * Dispatches to the visitor method for this shape.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result.
     */
    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Returns the metadata of the node. Shapes without metadata return {@link Metadata#EMPTY}.
     * @return The metadata.
     */
    Metadata meta();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic walker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<Node> getChildren() {
        return Collections.emptyList();
    }

    /**
     * A short, human readable name of the node's shape and tag, used in defect messages.
     * @return The description.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
