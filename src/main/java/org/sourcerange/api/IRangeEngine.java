package org.sourcerange.api;

import org.sourcerange.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Defines the public interface for computing source spans of syntax tree nodes.
 * <p>
 * Implementations are pure: they never mutate the tree and keep no state between calls, so one
 * instance may be shared between threads.
 */
public interface IRangeEngine {

    /**
     * Computes the range of a node.
     *
     * @param node The node, carrying the positional metadata attached by the parser.
     * @param options The options for this computation.
     * @return The half-open range the node occupies in its source.
     * @throws RangeException if the node violates the metadata contract.
     */
    Range getRange(Node node, RangeOptions options);

    /**
     * Computes the range of a node with the default options.
     * @param node The node.
     * @return The range of the node, without comments.
     */
    default Range getRange(Node node) {
        return getRange(node, RangeOptions.defaults());
    }

    /**
     * Computes the ranges of several independent nodes, typically the top-level expressions of
     * one file.
     *
     * @param nodes The nodes.
     * @param options The options applied to each node.
     * @return The ranges, in the order of the input.
     */
    default List<Range> getRanges(List<? extends Node> nodes, RangeOptions options) {
        List<Range> ranges = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            ranges.add(getRange(node, options));
        }
        return ranges;
    }
}
