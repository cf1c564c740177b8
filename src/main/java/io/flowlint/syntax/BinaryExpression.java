package io.flowlint.syntax;

import java.util.List;

public final class BinaryExpression extends Expression {

    public enum Operator {
        NULL_COALESCING("??", 1),
        CONDITIONAL_OR("||", 2),
        CONDITIONAL_AND("&&", 3),
        EQUALITY("==", 4),
        INEQUALITY("!=", 4),
        LESS_THAN("<", 5),
        GREATER_THAN(">", 5),
        LESS_THAN_OR_EQUAL("<=", 5),
        GREATER_THAN_OR_EQUAL(">=", 5),
        ADD("+", 6),
        SUBTRACT("-", 6),
        MULTIPLY("*", 7),
        DIVIDE("/", 7),
        MODULUS("%", 7);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        /**
         * Operators whose right operand is evaluated only for some values of the left one.
         */
        public boolean isShortCircuit() {
            return this == CONDITIONAL_OR || this == CONDITIONAL_AND || this == NULL_COALESCING;
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

    public BinaryExpression(TextSpan span, Expression left, Operator operator, Expression right) {
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
        return ExpressionKind.BINARY;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(left, right);
    }
}
