package io.flowlint.syntax;

import java.util.List;

public final class ForeachStatement extends Statement {

    private final String typeName;
    private final VariableDeclarator variable;
    private final Expression collection;
    private final Statement body;

    public ForeachStatement(TextSpan span, String typeName, VariableDeclarator variable,
                            Expression collection, Statement body) {
        super(span);
        this.typeName = typeName;
        this.variable = adopt(variable);
        this.collection = adopt(collection);
        this.body = adopt(body);
    }

    public String typeName() {
        return typeName;
    }

    public VariableDeclarator variable() {
        return variable;
    }

    public Expression collection() {
        return collection;
    }

    public Statement body() {
        return body;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.FOREACH;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(variable, collection, body);
    }
}
