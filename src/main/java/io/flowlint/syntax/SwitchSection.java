package io.flowlint.syntax;

import java.util.List;

/**
 * One or more {@code case}/{@code default} labels followed by statements.
 */
public final class SwitchSection extends SyntaxNode {

    private final List<Expression> caseLabels;
    private final boolean hasDefaultLabel;
    private final List<Statement> statements;

    public SwitchSection(TextSpan span, List<Expression> caseLabels, boolean hasDefaultLabel, List<Statement> statements) {
        super(span);
        this.caseLabels = adoptAll(caseLabels);
        this.hasDefaultLabel = hasDefaultLabel;
        this.statements = adoptAll(statements);
    }

    public List<Expression> caseLabels() {
        return caseLabels;
    }

    public boolean hasDefaultLabel() {
        return hasDefaultLabel;
    }

    public List<Statement> statements() {
        return statements;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(caseLabels, statements);
    }
}
