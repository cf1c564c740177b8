package io.flowlint.syntax;

import java.util.List;

/**
 * {@code using (resource) body}; the resource is either a declaration or an expression.
 */
public final class UsingStatement extends Statement {

    private final LocalDeclarationStatement declaration;
    private final Expression resource;
    private final Statement body;

    public UsingStatement(TextSpan span, LocalDeclarationStatement declaration, Expression resource, Statement body) {
        super(span);
        this.declaration = adopt(declaration);
        this.resource = adopt(resource);
        this.body = adopt(body);
    }

    public LocalDeclarationStatement declaration() {
        return declaration;
    }

    public Expression resource() {
        return resource;
    }

    public Statement body() {
        return body;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.USING;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(declaration, resource, body);
    }
}
