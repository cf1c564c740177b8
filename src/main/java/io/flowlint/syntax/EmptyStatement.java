package io.flowlint.syntax;

import java.util.List;

public final class EmptyStatement extends Statement {

    public EmptyStatement(TextSpan span) {
        super(span);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.EMPTY;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
