package io.flowlint.syntax;

import java.util.List;

public final class TryStatement extends Statement {

    private final BlockStatement tryBlock;
    private final List<CatchClause> catchClauses;
    private final BlockStatement finallyBlock;

    public TryStatement(TextSpan span, BlockStatement tryBlock, List<CatchClause> catchClauses,
                        BlockStatement finallyBlock) {
        super(span);
        this.tryBlock = adopt(tryBlock);
        this.catchClauses = adoptAll(catchClauses);
        this.finallyBlock = adopt(finallyBlock);
    }

    public BlockStatement tryBlock() {
        return tryBlock;
    }

    public List<CatchClause> catchClauses() {
        return catchClauses;
    }

    /**
     * Returns the finally block, or null when absent.
     */
    public BlockStatement finallyBlock() {
        return finallyBlock;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.TRY;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(tryBlock, catchClauses, finallyBlock);
    }
}
