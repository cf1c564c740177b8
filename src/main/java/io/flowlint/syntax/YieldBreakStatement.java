package io.flowlint.syntax;

import java.util.List;

public final class YieldBreakStatement extends Statement {

    public YieldBreakStatement(TextSpan span) {
        super(span);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.YIELD_BREAK;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
