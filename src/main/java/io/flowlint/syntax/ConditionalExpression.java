package io.flowlint.syntax;

import java.util.List;

/**
 * {@code condition ? whenTrue : whenFalse}.
 */
public final class ConditionalExpression extends Expression {

    private final Expression condition;
    private final Expression whenTrue;
    private final Expression whenFalse;

    public ConditionalExpression(TextSpan span, Expression condition, Expression whenTrue, Expression whenFalse) {
        super(span);
        this.condition = adopt(condition);
        this.whenTrue = adopt(whenTrue);
        this.whenFalse = adopt(whenFalse);
    }

    public Expression condition() {
        return condition;
    }

    public Expression whenTrue() {
        return whenTrue;
    }

    public Expression whenFalse() {
        return whenFalse;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(condition, whenTrue, whenFalse);
    }
}
