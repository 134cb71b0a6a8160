package org.sourcerange.ast;

import java.util.Objects;

/**
 * A source comment attached to a node by the parser.
 *
 * @param line The line the comment starts on.
 * @param column The column of the comment marker, or {@code null} if the parser did not record it.
 * @param text The full comment text, including the comment marker.
 */
public record Comment(int line, Integer column, String text) {

    public Comment {
        Objects.requireNonNull(text, "text");
    }

    /**
     * Returns the column of the comment, defaulting to 1 when it was not recorded.
     * @return The column.
     */
    public int columnOrDefault() {
        return column != null ? column : 1;
    }
}
