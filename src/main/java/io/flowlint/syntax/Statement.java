package io.flowlint.syntax;

public abstract class Statement extends SyntaxNode {

    protected Statement(TextSpan span) {
        super(span);
    }

    public abstract StatementKind statementKind();
}
