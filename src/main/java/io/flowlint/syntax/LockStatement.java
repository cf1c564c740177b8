package io.flowlint.syntax;

import java.util.List;

public final class LockStatement extends Statement {

    private final Expression lockObject;
    private final Statement body;

    public LockStatement(TextSpan span, Expression lockObject, Statement body) {
        super(span);
        this.lockObject = adopt(lockObject);
        this.body = adopt(body);
    }

    public Expression lockObject() {
        return lockObject;
    }

    public Statement body() {
        return body;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.LOCK;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(lockObject, body);
    }
}
