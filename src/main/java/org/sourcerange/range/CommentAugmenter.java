package org.sourcerange.range;

import org.sourcerange.api.Position;
import org.sourcerange.api.Range;
import org.sourcerange.ast.Comment;
import org.sourcerange.ast.Node;

import java.util.List;

/**
 * Widens a node's range to cover the comments the parser attached in front of it.
 * <p>
 * The start moves to the first comment. The end only moves when the last comment shares the
 * node's start line, i.e. when it is a trailing comment written on the same line.
 * Only minima and maxima against the given bounds are taken, so widening an already widened
 * range again changes nothing.
 * <p>
 * The node's start line is the one recorded in its own metadata, not the first line of its range.
 * The two differ for operators, qualified calls and access syntax, whose range starts at an
 * operand or receiver. Comparing against the range start would let a widened range, whose
 * start has moved to the first comment, pass the check on a second widening and grow again.
 * So in {@code foo # a long comment\n|> bar()} the comment sits on the line of {@code foo},
 * not of the pipe, and the range ends after {@code bar()}.
 */
public final class CommentAugmenter {

    private CommentAugmenter() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param range The range computed for the node.
     * @param node The node whose leading comments are considered.
     * @return The widened range, or {@code range} itself if the node has no leading comments.
     */
    public static Range widen(Range range, Node node) {
        List<Comment> comments = node.meta().leadingComments();
        if (comments.isEmpty()) {
            return range;
        }
        Comment first = comments.get(0);
        Comment last = comments.get(comments.size() - 1);

        Position start = new Position(first.line(), Math.min(range.start().column(), first.columnOrDefault()));

        int nodeLine = node.meta().line() != null ? node.meta().line() : range.start().line();
        int endColumn = range.end().column();
        if (last.line() == nodeLine) {
            endColumn = Math.max(endColumn, last.columnOrDefault() + TextMetrics.length(last.text()));
        }
        return new Range(start, range.end().withColumn(endColumn));
    }
}
