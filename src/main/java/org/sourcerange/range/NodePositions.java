package org.sourcerange.range;

import org.sourcerange.api.Position;
import org.sourcerange.api.RangeException;
import org.sourcerange.ast.DotCall;
import org.sourcerange.ast.Node;

/**
 * Start and closing positions as recorded in metadata, without computing full ranges.
 */
public final class NodePositions {

    /** Width of the {@code end} keyword. */
    static final int END_KEYWORD_WIDTH = 3;

    /** Width of a single-character closer: {@code )}, {@code ]} or {@code }}. */
    static final int CLOSER_WIDTH = 1;

    private NodePositions() {
        // Private constructor to prevent instantiation
    }

    /**
     * Whether the node's span is delimited by a recorded closing token or {@code end} keyword.
     */
    public static boolean hasClosingToken(Node node) {
        return node.meta().hasClosingToken();
    }

    /**
     * Returns the position where the node's text begins. A qualified call begins with its
     * receiver; access syntax ({@code map[key]}) begins with the accessed expression.
     *
     * @param node The node.
     * @return The start position.
     * @throws RangeException if the relevant node has no recorded position.
     */
    public static Position startPosition(Node node) {
        if (node instanceof DotCall call) {
            if (call.isAccess()) {
                if (call.args().isEmpty()) {
                    throw RangeException.malformed("access syntax without an accessed expression");
                }
                return startPosition(call.args().get(0));
            }
            return startPosition(call.dot().receiver());
        }
        return node.meta().requireStart(node.describe());
    }

    /**
     * Returns the position of the token that closes the node: the {@code end} keyword when the
     * node is a {@code do ... end} block, otherwise its closing bracket.
     */
    public static Position closingPosition(Node node) {
        return node.meta().requireClosingToken(node.describe());
    }

    /**
     * Returns the position just past the closing token.
     */
    public static Position endAfterClosingToken(Node node) {
        int width = node.meta().end() != null ? END_KEYWORD_WIDTH : CLOSER_WIDTH;
        return closingPosition(node).plusColumns(width);
    }
}
