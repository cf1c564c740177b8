package io.flowlint.syntax;

import java.util.List;

/**
 * {@code (params) => body} where the body is an expression or a block.
 */
public final class LambdaExpression extends Expression {

    private final List<ParameterDeclaration> parameters;
    private final TextSpan arrowSpan;
    private final SyntaxNode body;

    public LambdaExpression(TextSpan span, List<ParameterDeclaration> parameters, TextSpan arrowSpan, SyntaxNode body) {
        super(span);
        if (!(body instanceof Expression) && !(body instanceof BlockStatement)) {
            throw new IllegalArgumentException("Lambda body must be an expression or a block");
        }
        this.parameters = adoptAll(parameters);
        this.arrowSpan = arrowSpan;
        this.body = adopt(body);
    }

    public List<ParameterDeclaration> parameters() {
        return parameters;
    }

    public TextSpan arrowSpan() {
        return arrowSpan;
    }

    public SyntaxNode body() {
        return body;
    }

    public boolean hasBlockBody() {
        return body instanceof BlockStatement;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.LAMBDA;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(parameters, body);
    }
}
