package org.sourcerange.range;

import org.sourcerange.api.Position;
import org.sourcerange.api.Range;
import org.sourcerange.api.RangeErrorCode;
import org.sourcerange.api.RangeException;
import org.sourcerange.ast.Aliases;
import org.sourcerange.ast.AtomLiteral;
import org.sourcerange.ast.Block;
import org.sourcerange.ast.Call;
import org.sourcerange.ast.Dot;
import org.sourcerange.ast.DotCall;
import org.sourcerange.ast.Metadata;
import org.sourcerange.ast.ModuleRef;
import org.sourcerange.ast.Node;
import org.sourcerange.ast.NodeList;
import org.sourcerange.ast.NodeVisitor;
import org.sourcerange.ast.NumberLiteral;
import org.sourcerange.ast.Pair;
import org.sourcerange.ast.Sigil;
import org.sourcerange.ast.StringLiteral;
import org.sourcerange.ast.Text;
import org.sourcerange.ast.Variable;
import org.sourcerange.identifier.OperatorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Computes the range of a node from its structure and metadata, recursing into children where
 * a span is derived from them.
 * <p>
 * One instance serves one top-level computation; it only tracks the current depth.
 */
public class RangeVisitor implements NodeVisitor<Range> {

    private static final Logger LOG = LoggerFactory.getLogger(RangeVisitor.class);

    private static final String STAB = "->";
    private static final String STEPPED_RANGE = "..//";

    private final int maxDepth;
    private int depth = 0;

    /**
     * Creates a new visitor.
     * @param maxDepth The maximum nesting depth before {@link RangeErrorCode#DEPTH_LIMIT_EXCEEDED} is raised.
     */
    public RangeVisitor(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Computes the range of a node.
     * @param node The node.
     * @return Its range, never widened by comments.
     */
    public Range rangeOf(Node node) {
        if (depth >= maxDepth) {
            throw new RangeException(RangeErrorCode.DEPTH_LIMIT_EXCEEDED,
                    "tree is nested deeper than " + maxDepth + " levels");
        }
        depth++;
        try {
            LOG.trace("Dispatching {} at depth {}", node.describe(), depth);
            return node.accept(this);
        } finally {
            depth--;
        }
    }

    // region Literals

    @Override
    public Range visitNumberLiteral(NumberLiteral node) {
        String shape = node.describe();
        Position start = node.meta().requireStart(shape);
        String token = node.meta().requireToken(shape);
        return new Range(start, start.plusColumns(TextMetrics.length(token)));
    }

    @Override
    public Range visitStringLiteral(StringLiteral node) {
        Metadata meta = node.meta();
        String shape = node.describe();
        Position start = meta.requireStart(shape);
        String delimiter = meta.requireDelimiter(shape);
        List<String> lines = TextMetrics.splitLines(node.value());

        if (TextMetrics.isMultilineDelimiter(delimiter)) {
            // The closing delimiter sits on its own line after the last content line.
            int endLine = start.line() + lines.size();
            return new Range(start, new Position(endLine, start.column() + TextMetrics.length(delimiter)));
        }

        int endLine = start.line() + lines.size() - 1;
        int endColumn = start.column() + TextMetrics.length(lines.get(lines.size() - 1)) + TextMetrics.length(delimiter);
        if (endLine == start.line()) {
            // opening delimiter
            endColumn++;
        }
        return new Range(start, new Position(endLine, endColumn));
    }

    @Override
    public Range visitAtomLiteral(AtomLiteral node) {
        Metadata meta = node.meta();
        Position start = meta.requireStart(node.describe());
        String delimiter = meta.delimiter();
        List<String> lines = TextMetrics.splitLines(node.name());

        int endLine = start.line() + lines.size() - 1;
        int endColumn = start.column() + TextMetrics.length(lines.get(lines.size() - 1))
                + (delimiter != null ? TextMetrics.length(delimiter) : 0);
        if (endLine == start.line()) {
            // The colon, plus the opening delimiter of a quoted atom.
            endColumn += delimiter != null ? 2 : 1;
        }
        return new Range(start, new Position(endLine, endColumn));
    }

    @Override
    public Range visitVariable(Variable node) {
        Position start = node.meta().requireStart(node.describe());
        return new Range(start, start.plusColumns(TextMetrics.length(node.name())));
    }

    @Override
    public Range visitAliases(Aliases node) {
        List<String> segments = node.segments();
        if (segments.isEmpty()) {
            throw RangeException.malformed(node.describe() + " has no segments");
        }
        Position start = node.head() != null
                ? rangeOf(node.head()).start()
                : node.meta().requireStart(node.describe());
        Position last = node.meta().requireLast(node.describe());
        String lastSegment = segments.get(segments.size() - 1);
        return new Range(start, last.plusColumns(TextMetrics.length(lastSegment)));
    }

    @Override
    public Range visitSigil(Sigil node) {
        return InterpolationWalker.sigilRange(node);
    }

    // endregion

    // region Sequences

    @Override
    public Range visitBlock(Block node) {
        if (node.meta().hasClosingToken()) {
            return closingTokenRange(node);
        }
        if (node.args().isEmpty()) {
            throw RangeException.malformed("empty block without a closing token");
        }
        return span(node.args());
    }

    @Override
    public Range visitPair(Pair node) {
        return new Range(rangeOf(node.key()).start(), rangeOf(node.value()).end());
    }

    @Override
    public Range visitNodeList(NodeList node) {
        if (node.elements().isEmpty()) {
            throw RangeException.malformed("empty bare sequence of nodes");
        }
        return span(node.elements());
    }

    // endregion

    // region Calls

    @Override
    public Range visitCall(Call node) {
        String name = node.name();
        List<Node> args = node.args();

        if (STAB.equals(name) && args.size() == 2) {
            return new Range(rangeOf(args.get(0)).start(), rangeOf(args.get(1)).end());
        }
        if (args.size() == 1 && OperatorClassifier.isUnary(name)) {
            return unaryOperatorRange(node);
        }
        if (args.size() == 2 && OperatorClassifier.isBinary(name)) {
            return new Range(rangeOf(args.get(0)).start(), rangeOf(args.get(1)).end());
        }
        if (STEPPED_RANGE.equals(name) && args.size() == 3) {
            return new Range(rangeOf(args.get(0)).start(), rangeOf(args.get(2)).end());
        }
        if (InterpolationWalker.BITSTRING.equals(name)) {
            if (node.meta().delimiter() != null) {
                return InterpolationWalker.interpolationRange(node, node.meta().delimiter());
            }
            return bitstringRange(node);
        }
        return unqualifiedCallRange(node);
    }

    @Override
    public Range visitDotCall(DotCall node) {
        if (node.isAccess() || node.isQualifiedTuple()) {
            return closingTokenRange(node);
        }
        if (node.isInterpolatedAtom()) {
            if (node.args().isEmpty() || !(node.args().get(0) instanceof Call body)
                    || !InterpolationWalker.BITSTRING.equals(body.name())) {
                throw RangeException.malformed(node.describe() + " is an interpolated atom without a body");
            }
            return InterpolationWalker.interpolationRange(body, node.meta().delimiter());
        }
        if (node.meta().hasClosingToken()) {
            return closingTokenRange(node);
        }

        Dot dot = node.dot();
        Position start = rangeOf(dot.receiver()).start();
        if (!node.args().isEmpty()) {
            return new Range(start, rangeOf(node.args().get(node.args().size() - 1)).end());
        }

        Position identifier = node.meta().requireStart(node.describe());
        int memberLength = dot.isAnonymous() ? 0 : TextMetrics.length(dot.member());
        int parensLength = node.meta().noParens() ? 0 : 2;
        return new Range(start, identifier.plusColumns(memberLength + parensLength));
    }

    @Override
    public Range visitDot(Dot node) {
        throw RangeException.malformed(node.describe() + " is only spanned as part of its call");
    }

    private Range unaryOperatorRange(Call node) {
        Position start = node.meta().requireStart(node.describe());
        Position operandEnd = rangeOf(node.args().get(0)).end();
        int endColumn = operandEnd.line() == start.line()
                ? operandEnd.column()
                : operandEnd.column() + TextMetrics.length(node.name());
        return new Range(start, new Position(operandEnd.line(), endColumn));
    }

    private Range unqualifiedCallRange(Call node) {
        if (node.meta().hasClosingToken()) {
            return closingTokenRange(node);
        }
        Position start = node.meta().requireStart(node.describe());
        if (node.args().isEmpty()) {
            return new Range(start, start);
        }
        return new Range(start, rangeOf(node.args().get(node.args().size() - 1)).end());
    }

    private Range bitstringRange(Call node) {
        Range range = closingTokenRange(node);
        // ">>" is one column wider than the single-character closers
        return new Range(range.start(), range.end().plusColumns(1));
    }

    private Range closingTokenRange(Node node) {
        return new Range(NodePositions.startPosition(node), NodePositions.endAfterClosingToken(node));
    }

    // endregion

    // region Raw segments

    @Override
    public Range visitText(Text node) {
        throw RangeException.malformed("raw text segment has no position outside of its literal");
    }

    @Override
    public Range visitModuleRef(ModuleRef node) {
        throw RangeException.malformed(node.describe() + " does not appear in the source");
    }

    // endregion

    private Range span(List<Node> nodes) {
        Range first = rangeOf(nodes.get(0));
        if (nodes.size() == 1) {
            return first;
        }
        return new Range(first.start(), rangeOf(nodes.get(nodes.size() - 1)).end());
    }
}
