package io.flowlint.syntax;

import java.util.List;

/**
 * {@code continue;} jumping to the next iteration of the innermost enclosing loop.
 */
public final class ContinueStatement extends Statement {

    public ContinueStatement(TextSpan span) {
        super(span);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.CONTINUE;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
