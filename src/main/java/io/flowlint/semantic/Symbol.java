package io.flowlint.semantic;

import io.flowlint.syntax.SyntaxNode;

/**
 * A declared entity. Two symbols are equal iff they denote the same declaration node,
 * since syntax nodes compare by identity.
 *
 * @param kind        what was declared
 * @param name        simple name
 * @param declaration declaring node (for the implicit accessor {@code value} parameter, the accessor)
 */
public record Symbol(SymbolKind kind, String name, SyntaxNode declaration) {

    public Symbol {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (declaration == null) {
            throw new IllegalArgumentException("declaration cannot be null");
        }
    }

    @Override
    public String toString() {
        return kind + " " + name + "@" + declaration.start();
    }
}
