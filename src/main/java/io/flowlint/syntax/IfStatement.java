package io.flowlint.syntax;

import java.util.List;

public final class IfStatement extends Statement {

    private final Expression condition;
    private final Statement thenStatement;
    private final Statement elseStatement;

    public IfStatement(TextSpan span, Expression condition, Statement thenStatement, Statement elseStatement) {
        super(span);
        this.condition = adopt(condition);
        this.thenStatement = adopt(thenStatement);
        this.elseStatement = adopt(elseStatement);
    }

    public Expression condition() {
        return condition;
    }

    public Statement thenStatement() {
        return thenStatement;
    }

    /**
     * Returns the else branch, or null when absent.
     */
    public Statement elseStatement() {
        return elseStatement;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.IF;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(condition, thenStatement, elseStatement);
    }
}
