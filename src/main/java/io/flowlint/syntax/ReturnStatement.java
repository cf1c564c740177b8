package io.flowlint.syntax;

import java.util.List;

public final class ReturnStatement extends Statement {

    private final Expression expression;

    public ReturnStatement(TextSpan span, Expression expression) {
        super(span);
        this.expression = adopt(expression);
    }

    /**
     * Returns the returned value, or null for a bare {@code return;}.
     */
    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.RETURN;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(expression);
    }
}
