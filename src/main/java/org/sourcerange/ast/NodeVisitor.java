package org.sourcerange.ast;

/**
 * Visitor over the closed set of {@link Node} shapes.
 *
 * @param <R> The result type.
 */
public interface NodeVisitor<R> {

    R visitNumberLiteral(NumberLiteral node);

    R visitStringLiteral(StringLiteral node);

    R visitAtomLiteral(AtomLiteral node);

    R visitBlock(Block node);

    R visitVariable(Variable node);

    R visitAliases(Aliases node);

    R visitPair(Pair node);

    R visitNodeList(NodeList node);

    R visitCall(Call node);

    R visitSigil(Sigil node);

    R visitDot(Dot node);

    R visitDotCall(DotCall node);

    R visitText(Text node);

    R visitModuleRef(ModuleRef node);
}
