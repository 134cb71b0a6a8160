package org.sourcerange.api;

import java.util.Objects;

/**
 * The span a node occupies in its source text.
 * <p>
 * The range is half-open: {@code start} is the first character of the node, {@code end} is one
 * column past its last character on its last line. Slicing the source with {@code [start, end)}
 * therefore yields exactly the node's text.
 *
 * @param start The first position covered by the node.
 * @param end The position just past the node.
 */
public record Range(Position start, Position end) {

    public Range {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(String.format("Range start %s is after end %s", start, end));
        }
    }

    public static Range of(int startLine, int startColumn, int endLine, int endColumn) {
        return new Range(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    /**
     * Checks whether the other range lies completely within this one.
     * @param other The range to test.
     * @return {@code true} if {@code other} is enclosed by this range (bounds may touch).
     */
    public boolean contains(Range other) {
        return start.compareTo(other.start) <= 0 && end.compareTo(other.end) >= 0;
    }

    /**
     * Checks whether a position is covered by this range.
     * @param position The position to test.
     * @return {@code true} if {@code start <= position < end}.
     */
    public boolean contains(Position position) {
        return start.compareTo(position) <= 0 && end.isAfter(position);
    }

    /**
     * Returns the smallest range covering both this range and the other one.
     * @param other The other range.
     * @return The union of both ranges.
     */
    public Range union(Range other) {
        return new Range(Position.min(start, other.start), Position.max(end, other.end));
    }

    /**
     * Extracts the text covered by this range from the given source.
     * <p>
     * Lines are separated by {@code \n}, {@code \r\n} or {@code \r}; line breaks inside the range
     * are copied as they appear in the source.
     *
     * @param source The complete source text the range was computed for.
     * @return The covered substring.
     * @throws IllegalArgumentException if the range lies outside the source.
     */
    public String slice(String source) {
        int from = offsetOf(source, start);
        int to = offsetOf(source, end);
        return source.substring(from, to);
    }

    private static int offsetOf(String source, Position position) {
        int line = 1;
        int offset = 0;
        while (line < position.line()) {
            if (offset >= source.length()) {
                throw new IllegalArgumentException("Line " + position.line() + " is outside the source");
            }
            char c = source.charAt(offset++);
            if (c == '\r') {
                if (offset < source.length() && source.charAt(offset) == '\n') {
                    offset++;
                }
                line++;
            } else if (c == '\n') {
                line++;
            }
        }
        try {
            return source.offsetByCodePoints(offset, position.column() - 1);
        } catch (IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Column " + position + " is outside the source", e);
        }
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
