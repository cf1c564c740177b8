package io.flowlint.syntax;

import java.util.List;

public final class UnaryExpression extends Expression {

    public enum Operator {
        NOT,
        MINUS,
        PLUS,
        INCREMENT,
        DECREMENT,
        POST_INCREMENT,
        POST_DECREMENT;

        public boolean isIncrementOrDecrement() {
            return this == INCREMENT || this == DECREMENT || this == POST_INCREMENT || this == POST_DECREMENT;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(TextSpan span, Operator operator, Expression operand) {
        super(span);
        this.operator = operator;
        this.operand = adopt(operand);
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.UNARY;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(operand);
    }
}
