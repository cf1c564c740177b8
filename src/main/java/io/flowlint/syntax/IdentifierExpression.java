package io.flowlint.syntax;

import java.util.List;

public final class IdentifierExpression extends Expression {

    private final String name;

    public IdentifierExpression(TextSpan span, String name) {
        super(span);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.IDENTIFIER;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
