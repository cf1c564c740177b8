package io.flowlint.syntax;

import java.util.List;

/**
 * {@code Type a = 1, b;} or {@code var a = x;}. Also used for the declaration part of
 * {@code for} and {@code using} headers.
 */
public final class LocalDeclarationStatement extends Statement {

    private final String typeName;
    private final List<VariableDeclarator> variables;

    public LocalDeclarationStatement(TextSpan span, String typeName, List<VariableDeclarator> variables) {
        super(span);
        this.typeName = typeName;
        this.variables = adoptAll(variables);
    }

    public String typeName() {
        return typeName;
    }

    public List<VariableDeclarator> variables() {
        return variables;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.LOCAL_DECLARATION;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(variables);
    }
}
