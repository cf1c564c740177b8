package io.flowlint.syntax;

public abstract class Expression extends SyntaxNode {

    protected Expression(TextSpan span) {
        super(span);
    }

    public abstract ExpressionKind expressionKind();
}
