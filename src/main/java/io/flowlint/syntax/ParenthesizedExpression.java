package io.flowlint.syntax;

import java.util.List;

public final class ParenthesizedExpression extends Expression {

    private final Expression expression;

    public ParenthesizedExpression(TextSpan span, Expression expression) {
        super(span);
        this.expression = adopt(expression);
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.PARENTHESIZED;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(expression);
    }
}
