package org.sourcerange.range;

import org.sourcerange.api.Position;
import org.sourcerange.api.Range;
import org.sourcerange.api.RangeException;
import org.sourcerange.ast.Call;
import org.sourcerange.ast.Node;
import org.sourcerange.ast.Sigil;
import org.sourcerange.ast.Text;
import org.sourcerange.ast.Variable;

import java.util.List;

/**
 * Computes the end of literals made of interpolation segments: interpolated strings and atoms,
 * and sigils.
 * <p>
 * Literal text segments advance the position by their line breaks and the length of their last
 * line. An embedded expression carries the position of its closing brace, so the walk jumps to
 * just past it.
 */
public final class InterpolationWalker {

    static final String DEFAULT_DELIMITER = "\"";

    static final String BITSTRING = "<<>>";

    private static final String TYPE_OPERATOR = "::";

    private InterpolationWalker() {
        // Private constructor to prevent instantiation
    }

    /**
     * Computes the range of an interpolated string or atom body.
     *
     * @param body The {@code <<>>} call holding the segments.
     * @param delimiter The delimiter of the literal, or {@code null} for a plain double quote.
     * @return The range of the literal.
     */
    public static Range interpolationRange(Call body, String delimiter) {
        Position start = body.meta().requireStart(body.describe());
        String effective = delimiter != null ? delimiter : DEFAULT_DELIMITER;
        return new Range(start, endOfSegments(body.args(), effective, start));
    }

    /**
     * Computes the range of a sigil, including its prefix and modifier letters.
     */
    public static Range sigilRange(Sigil sigil) {
        String shape = sigil.describe();
        if (!BITSTRING.equals(sigil.body().name())) {
            throw RangeException.malformed(shape + " has a body that is not a " + BITSTRING + " call");
        }
        Position start = sigil.meta().requireStart(shape);
        String delimiter = sigil.meta().requireDelimiter(shape);
        List<Node> segments = sigil.body().args();

        Position end = endOfSegments(segments, delimiter, start)
                .plusColumns(TextMetrics.length(sigil.modifiers()));

        boolean multiline = TextMetrics.isMultilineDelimiter(delimiter);
        boolean interpolated = hasInterpolations(segments);
        if (multiline && !interpolated) {
            // The body of a heredoc sigil without interpolation never starts with the newline
            // after the opening delimiter, so the walk ends one line short. The closing
            // delimiter is assumed to be indented like the sigil itself.
            end = new Position(end.line() + 1, start.column() + 3);
        } else if (!multiline && !interpolated) {
            // "~" and the sigil name. That is 2 columns for the usual one-letter sigils, but
            // upper-case sigils may have longer names, so ~HTML"x" ends at column 9.
            end = end.plusColumns(1 + TextMetrics.length(sigil.name()));
        }
        return new Range(start, end);
    }

    /**
     * Walks the segments from the start of the literal and returns the position just past its
     * closing delimiter.
     *
     * @param segments Literal text and embedded expressions, in source order.
     * @param delimiter The literal's delimiter.
     * @param start The start position of the literal.
     * @return The end position.
     */
    public static Position endOfSegments(List<Node> segments, String delimiter, Position start) {
        Position position = start;
        for (Node segment : segments) {
            if (segment instanceof Text text) {
                List<String> lines = TextMetrics.splitLines(text.value());
                int length = TextMetrics.length(lines.get(lines.size() - 1));
                int lineCount = lines.size() - 1;
                int column = lineCount > 0 ? start.column() + length : position.column() + length;
                position = new Position(position.line() + lineCount, column);
            } else if (isInterpolation(segment)) {
                Node expression = ((Call) segment).args().get(0);
                // past the closing brace
                position = expression.meta().requireClosing(expression.describe()).plusColumns(1);
            } else {
                throw RangeException.malformed("unexpected interpolation segment " + segment.describe());
            }
        }

        boolean interpolated = hasInterpolations(segments);
        if (TextMetrics.isMultilineDelimiter(delimiter) && interpolated) {
            return new Position(position.line(), TextMetrics.length(delimiter) + 1);
        }
        if (interpolated) {
            return position.plusColumns(1);
        }
        return position.plusColumns(2);
    }

    public static boolean hasInterpolations(List<Node> segments) {
        for (Node segment : segments) {
            if (segment instanceof Call call && TYPE_OPERATOR.equals(call.name())) {
                return true;
            }
        }
        return false;
    }

    /**
     * An embedded expression is encoded as {@code expression :: binary}.
     */
    private static boolean isInterpolation(Node segment) {
        if (!(segment instanceof Call call) || !TYPE_OPERATOR.equals(call.name()) || call.args().size() != 2) {
            return false;
        }
        Node type = call.args().get(1);
        return (type instanceof Variable variable && "binary".equals(variable.name()))
                || (type instanceof Call typeCall && "binary".equals(typeCall.name()));
    }
}
