package io.flowlint.semantic;

import io.flowlint.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Narrow view of the semantic model consumed by the rules.
 * <p>
 * "Cannot resolve" is an expected answer and is reported as an empty result, never as
 * an exception. Implementations throw {@link AnalysisException} only when asked about a
 * node that does not belong to the tree they were built for.
 */
public interface SymbolResolver {

    /**
     * Returns the entity the node refers to: the member an identifier, member access or
     * invocation names, or the symbol a declaration declares.
     */
    Optional<Symbol> resolve(SyntaxNode node);

    /**
     * Returns what a bare simple name would bind to if written at the given position.
     */
    Optional<Symbol> lookup(String name, SyntaxNode position);
}
