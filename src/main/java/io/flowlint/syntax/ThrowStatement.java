package io.flowlint.syntax;

import java.util.List;

public final class ThrowStatement extends Statement {

    private final Expression expression;

    public ThrowStatement(TextSpan span, Expression expression) {
        super(span);
        this.expression = adopt(expression);
    }

    /**
     * Returns the thrown exception, or null for a rethrow inside a catch clause.
     */
    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.THROW;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(expression);
    }
}
