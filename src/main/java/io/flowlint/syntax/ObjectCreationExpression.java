package io.flowlint.syntax;

import java.util.List;

public final class ObjectCreationExpression extends Expression {

    private final String typeName;
    private final List<Expression> arguments;

    public ObjectCreationExpression(TextSpan span, String typeName, List<Expression> arguments) {
        super(span);
        this.typeName = typeName;
        this.arguments = adoptAll(arguments);
    }

    public String typeName() {
        return typeName;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.OBJECT_CREATION;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(arguments);
    }
}
