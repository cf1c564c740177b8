package io.flowlint.syntax;

import java.util.List;

public final class LiteralExpression extends Expression {

    public enum Kind {
        BOOLEAN,
        NUMBER,
        STRING,
        CHARACTER,
        NULL
    }

    private final Kind kind;
    private final String text;

    public LiteralExpression(TextSpan span, Kind kind, String text) {
        super(span);
        this.kind = kind;
        this.text = text;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Source text of the literal, quotes included.
     */
    public String text() {
        return text;
    }

    public boolean isTrue() {
        return kind == Kind.BOOLEAN && "true".equals(text);
    }

    public boolean isFalse() {
        return kind == Kind.BOOLEAN && "false".equals(text);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.LITERAL;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
