package io.flowlint.syntax;

import java.util.List;

public final class InvocationExpression extends Expression {

    private final Expression target;
    private final List<Expression> arguments;

    public InvocationExpression(TextSpan span, Expression target, List<Expression> arguments) {
        super(span);
        this.target = adopt(target);
        this.arguments = adoptAll(arguments);
    }

    public Expression target() {
        return target;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.INVOCATION;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(target, arguments);
    }
}
