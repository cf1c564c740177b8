package io.flowlint.syntax;

import java.util.List;

public final class ExpressionStatement extends Statement {

    private final Expression expression;

    public ExpressionStatement(TextSpan span, Expression expression) {
        super(span);
        this.expression = adopt(expression);
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.EXPRESSION;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(expression);
    }
}
