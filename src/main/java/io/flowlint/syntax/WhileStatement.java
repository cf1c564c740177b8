package io.flowlint.syntax;

import java.util.List;

public final class WhileStatement extends Statement {

    private final Expression condition;
    private final Statement body;

    public WhileStatement(TextSpan span, Expression condition, Statement body) {
        super(span);
        this.condition = adopt(condition);
        this.body = adopt(body);
    }

    public Expression condition() {
        return condition;
    }

    public Statement body() {
        return body;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.WHILE;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(condition, body);
    }
}
