package io.flowlint.syntax;

import java.util.List;

public final class BlockStatement extends Statement {

    private final List<Statement> statements;

    public BlockStatement(TextSpan span, List<Statement> statements) {
        super(span);
        this.statements = adoptAll(statements);
    }

    public List<Statement> statements() {
        return statements;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.BLOCK;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(statements);
    }
}
