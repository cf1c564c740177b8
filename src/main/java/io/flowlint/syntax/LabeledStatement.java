package io.flowlint.syntax;

import java.util.List;

/**
 * {@code label: statement}, a possible {@code goto} target.
 */
public final class LabeledStatement extends Statement {

    private final String label;
    private final TextSpan labelSpan;
    private final Statement statement;

    public LabeledStatement(TextSpan span, String label, TextSpan labelSpan, Statement statement) {
        super(span);
        this.label = label;
        this.labelSpan = labelSpan;
        this.statement = adopt(statement);
    }

    public String label() {
        return label;
    }

    public TextSpan labelSpan() {
        return labelSpan;
    }

    public Statement statement() {
        return statement;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.LABELED;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(statement);
    }
}
