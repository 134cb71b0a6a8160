package org.sourcerange.api;

/**
 * A position in the source code.
 * <p>
 * Both components are 1-indexed. The column is counted in characters (Unicode code points),
 * not in bytes or UTF-16 units, so a position maps directly onto what an editor shows.
 *
 * @param line The line number, starting at 1.
 * @param column The column number, starting at 1.
 */
public record Position(int line, int column) implements Comparable<Position> {

    public Position {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException(String.format("Position must be 1-indexed, got %d:%d", line, column));
        }
    }

    /**
     * Returns a new position on the same line, shifted by the given number of columns.
     * @param delta The number of columns to add (may be negative).
     * @return The shifted position.
     */
    public Position plusColumns(int delta) {
        return new Position(line, column + delta);
    }

    /**
     * Returns a new position on the same line with the given column.
     * @param newColumn The new column.
     * @return The new position.
     */
    public Position withColumn(int newColumn) {
        return new Position(line, newColumn);
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    public boolean isAfter(Position other) {
        return compareTo(other) > 0;
    }

    public static Position min(Position a, Position b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static Position max(Position a, Position b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
