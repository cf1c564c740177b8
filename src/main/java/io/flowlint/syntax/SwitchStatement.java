package io.flowlint.syntax;

import java.util.List;

public final class SwitchStatement extends Statement {

    private final Expression expression;
    private final List<SwitchSection> sections;

    public SwitchStatement(TextSpan span, Expression expression, List<SwitchSection> sections) {
        super(span);
        this.expression = adopt(expression);
        this.sections = adoptAll(sections);
    }

    public Expression expression() {
        return expression;
    }

    public List<SwitchSection> sections() {
        return sections;
    }

    public boolean hasDefaultSection() {
        return sections.stream().anyMatch(SwitchSection::hasDefaultLabel);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.SWITCH;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(expression, sections);
    }
}
