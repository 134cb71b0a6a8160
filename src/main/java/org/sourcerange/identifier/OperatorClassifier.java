package org.sourcerange.identifier;

import java.util.Set;

/**
 * Static lookup of the language's operator tags.
 * <p>
 * Whether an operator application is unary or binary also depends on its argument count; the
 * classifier only answers which forms a tag supports.
 */
public final class OperatorClassifier {

    private static final Set<String> UNARY_OPERATORS = Set.of(
            "!", "^", "not", "+", "-", "~~~", "&", "@"
    );

    private static final Set<String> BINARY_OPERATORS = Set.of(
            "<-", "\\\\", "when", "::", "|", "=", "||", "|||", "or", "&&", "&&&", "and",
            "==", "!=", "=~", "===", "!==", "<", "<=", ">=", ">",
            "|>", "<<<", ">>>", "<<~", "~>>", "<~", "~>", "<~>", "<|>",
            "in", "not in", "++", "--", "..", "<>",
            "+", "-", "^^^", "*", "/", ".", "+++", "---", "**", "//"
    );

    private OperatorClassifier() {
        // Private constructor to prevent instantiation
    }

    /**
     * Classifies an operator tag.
     * @param tag The tag, e.g. {@code "+"} or {@code "not in"}.
     * @return The kind of the tag; {@link OperatorKind#NONE} for anything that is not an operator.
     */
    public static OperatorKind classify(String tag) {
        boolean unary = UNARY_OPERATORS.contains(tag);
        boolean binary = BINARY_OPERATORS.contains(tag);
        if (unary && binary) {
            return OperatorKind.UNARY_OR_BINARY;
        }
        if (unary) {
            return OperatorKind.UNARY;
        }
        return binary ? OperatorKind.BINARY : OperatorKind.NONE;
    }

    public static boolean isUnary(String tag) {
        return UNARY_OPERATORS.contains(tag);
    }

    public static boolean isBinary(String tag) {
        return BINARY_OPERATORS.contains(tag);
    }
}
