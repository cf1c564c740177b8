package io.flowlint.syntax;

import java.util.List;

/**
 * {@code break;} leaving the innermost enclosing loop or switch.
 */
public final class BreakStatement extends Statement {

    public BreakStatement(TextSpan span) {
        super(span);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.BREAK;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
