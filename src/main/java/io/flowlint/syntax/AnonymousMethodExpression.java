package io.flowlint.syntax;

import java.util.List;

/**
 * {@code delegate (params) { ... }}.
 */
public final class AnonymousMethodExpression extends Expression {

    private final TextSpan delegateKeywordSpan;
    private final List<ParameterDeclaration> parameters;
    private final BlockStatement body;

    public AnonymousMethodExpression(TextSpan span, TextSpan delegateKeywordSpan,
                                     List<ParameterDeclaration> parameters, BlockStatement body) {
        super(span);
        this.delegateKeywordSpan = delegateKeywordSpan;
        this.parameters = adoptAll(parameters);
        this.body = adopt(body);
    }

    public TextSpan delegateKeywordSpan() {
        return delegateKeywordSpan;
    }

    public List<ParameterDeclaration> parameters() {
        return parameters;
    }

    public BlockStatement body() {
        return body;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.ANONYMOUS_METHOD;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(parameters, body);
    }
}
