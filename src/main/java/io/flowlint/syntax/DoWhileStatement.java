package io.flowlint.syntax;

import java.util.List;

public final class DoWhileStatement extends Statement {

    private final Statement body;
    private final Expression condition;

    public DoWhileStatement(TextSpan span, Statement body, Expression condition) {
        super(span);
        this.body = adopt(body);
        this.condition = adopt(condition);
    }

    public Statement body() {
        return body;
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.DO_WHILE;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(body, condition);
    }
}
