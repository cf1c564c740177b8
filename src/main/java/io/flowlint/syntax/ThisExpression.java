package io.flowlint.syntax;

import java.util.List;

public final class ThisExpression extends Expression {

    public ThisExpression(TextSpan span) {
        super(span);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.THIS;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
