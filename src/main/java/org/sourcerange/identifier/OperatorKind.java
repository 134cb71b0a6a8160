package org.sourcerange.identifier;

/**
 * How an operator tag may be applied.
 */
public enum OperatorKind {
    /** Prefix operator with a single operand, e.g. {@code not}. */
    UNARY,
    /** Infix operator with two operands, e.g. {@code |>}. */
    BINARY,
    /** Operator usable both ways, e.g. {@code -}. */
    UNARY_OR_BINARY,
    /** Not an operator. */
    NONE;

    public boolean isUnary() {
        return this == UNARY || this == UNARY_OR_BINARY;
    }

    public boolean isBinary() {
        return this == BINARY || this == UNARY_OR_BINARY;
    }
}
