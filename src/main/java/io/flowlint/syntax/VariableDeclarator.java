package io.flowlint.syntax;

import java.util.List;

/**
 * One declared name in a field, local, foreach or catch declaration, with its optional initializer.
 */
public final class VariableDeclarator extends SyntaxNode {

    private final String name;
    private final TextSpan nameSpan;
    private final Expression initializer;

    public VariableDeclarator(TextSpan span, String name, TextSpan nameSpan, Expression initializer) {
        super(span);
        this.name = name;
        this.nameSpan = nameSpan;
        this.initializer = adopt(initializer);
    }

    public String name() {
        return name;
    }

    public TextSpan nameSpan() {
        return nameSpan;
    }

    public Expression initializer() {
        return initializer;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(initializer);
    }
}
