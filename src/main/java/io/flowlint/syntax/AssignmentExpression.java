package io.flowlint.syntax;

import java.util.List;

public final class AssignmentExpression extends Expression {

    public enum Operator {
        ASSIGN("="),
        ADD("+="),
        SUBTRACT("-="),
        MULTIPLY("*="),
        DIVIDE("/="),
        MODULUS("%="),
        NULL_COALESCING("??=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public AssignmentExpression(TextSpan span, Expression left, Operator operator, Expression right) {
        super(span);
        this.left = adopt(left);
        this.operator = operator;
        this.right = adopt(right);
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.ASSIGNMENT;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(left, right);
    }
}
