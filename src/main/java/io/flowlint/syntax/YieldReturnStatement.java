package io.flowlint.syntax;

import java.util.List;

public final class YieldReturnStatement extends Statement {

    private final Expression expression;

    public YieldReturnStatement(TextSpan span, Expression expression) {
        super(span);
        this.expression = adopt(expression);
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.YIELD_RETURN;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(expression);
    }
}
