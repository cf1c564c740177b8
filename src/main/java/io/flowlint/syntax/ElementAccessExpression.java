package io.flowlint.syntax;

import java.util.List;

/**
 * {@code target[index, ...]}: array element or indexer access.
 */
public final class ElementAccessExpression extends Expression {

    private final Expression target;
    private final List<Expression> indices;

    public ElementAccessExpression(TextSpan span, Expression target, List<Expression> indices) {
        super(span);
        this.target = adopt(target);
        this.indices = adoptAll(indices);
    }

    public Expression target() {
        return target;
    }

    public List<Expression> indices() {
        return indices;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.ELEMENT_ACCESS;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(target, indices);
    }
}
