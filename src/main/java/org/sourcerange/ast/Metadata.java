package org.sourcerange.ast;

import org.sourcerange.api.Position;
import org.sourcerange.api.RangeException;

import java.util.List;

/**
 * Positional and structural facts the parser attaches to a node.
 * <p>
 * Every field is optional on its own; which ones must be present depends on the shape of the
 * node. The {@code require*} accessors fail with a {@code MISSING_METADATA} defect when a field
 * needed by the caller is absent.
 *
 * @param line The line of the node's own token.
 * @param column The column of the node's own token.
 * @param closing The position of the closing token (bracket, parenthesis, brace).
 * @param end The position of the {@code end} keyword of a {@code do ... end} block.
 * @param delimiter The delimiter text of a string, atom, sigil or heredoc.
 * @param last The position of the final segment of a qualified name.
 * @param noParens Whether a call was written without parentheses.
 * @param token The rendered text of a numeric literal.
 * @param leadingComments Comments placed before the node.
 * @param trailingComments Comments placed after the node's last child.
 */
public record Metadata(
        Integer line,
        Integer column,
        Position closing,
        Position end,
        String delimiter,
        Position last,
        boolean noParens,
        String token,
        List<Comment> leadingComments,
        List<Comment> trailingComments
) {

    public static final Metadata EMPTY = builder().build();

    public Metadata {
        leadingComments = leadingComments == null ? List.of() : List.copyOf(leadingComments);
        trailingComments = trailingComments == null ? List.of() : List.copyOf(trailingComments);
    }

    /**
     * Shorthand for metadata holding only a start position.
     */
    public static Metadata at(int line, int column) {
        return builder().line(line).column(column).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether the node ends with a recorded closing token or {@code end} keyword.
     */
    public boolean hasClosingToken() {
        return closing != null || end != null;
    }

    public int requireLine(String shape) {
        if (line == null) {
            throw RangeException.missingMetadata(shape, "line");
        }
        return line;
    }

    public int requireColumn(String shape) {
        if (column == null) {
            throw RangeException.missingMetadata(shape, "column");
        }
        return column;
    }

    public Position requireStart(String shape) {
        return new Position(requireLine(shape), requireColumn(shape));
    }

    /**
     * Returns the position of the token that closes the node: the {@code end} keyword when
     * present, the closing bracket otherwise.
     */
    public Position requireClosingToken(String shape) {
        if (end != null) {
            return end;
        }
        if (closing == null) {
            throw RangeException.missingMetadata(shape, "closing");
        }
        return closing;
    }

    public Position requireClosing(String shape) {
        if (closing == null) {
            throw RangeException.missingMetadata(shape, "closing");
        }
        return closing;
    }

    public String requireDelimiter(String shape) {
        if (delimiter == null) {
            throw RangeException.missingMetadata(shape, "delimiter");
        }
        return delimiter;
    }

    public Position requireLast(String shape) {
        if (last == null) {
            throw RangeException.missingMetadata(shape, "last");
        }
        return last;
    }

    public String requireToken(String shape) {
        if (token == null) {
            throw RangeException.missingMetadata(shape, "token");
        }
        return token;
    }

    /**
     * Mutable builder for {@link Metadata}. Parsers fill in the fields they know about.
     */
    public static final class Builder {
        private Integer line;
        private Integer column;
        private Position closing;
        private Position end;
        private String delimiter;
        private Position last;
        private boolean noParens;
        private String token;
        private List<Comment> leadingComments = List.of();
        private List<Comment> trailingComments = List.of();

        private Builder() {
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder column(Integer column) {
            this.column = column;
            return this;
        }

        public Builder at(int line, int column) {
            return line(line).column(column);
        }

        public Builder closing(Position closing) {
            this.closing = closing;
            return this;
        }

        public Builder closing(int line, int column) {
            return closing(new Position(line, column));
        }

        public Builder end(Position end) {
            this.end = end;
            return this;
        }

        public Builder end(int line, int column) {
            return end(new Position(line, column));
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder last(Position last) {
            this.last = last;
            return this;
        }

        public Builder last(int line, int column) {
            return last(new Position(line, column));
        }

        public Builder noParens(boolean noParens) {
            this.noParens = noParens;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder leadingComments(List<Comment> comments) {
            this.leadingComments = comments;
            return this;
        }

        public Builder trailingComments(List<Comment> comments) {
            this.trailingComments = comments;
            return this;
        }

        public Metadata build() {
            return new Metadata(line, column, closing, end, delimiter, last, noParens, token,
                    leadingComments, trailingComments);
        }
    }
}
