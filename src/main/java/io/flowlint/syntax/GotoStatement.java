package io.flowlint.syntax;

import java.util.List;

/**
 * {@code goto label;}, {@code goto case value;} or {@code goto default;}.
 */
public final class GotoStatement extends Statement {

    public enum Target {
        LABEL,
        CASE,
        DEFAULT
    }

    private final Target target;
    private final String label;
    private final Expression caseValue;

    private GotoStatement(TextSpan span, Target target, String label, Expression caseValue) {
        super(span);
        this.target = target;
        this.label = label;
        this.caseValue = adopt(caseValue);
    }

    public static GotoStatement toLabel(TextSpan span, String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        return new GotoStatement(span, Target.LABEL, label, null);
    }

    public static GotoStatement toCase(TextSpan span, Expression caseValue) {
        if (caseValue == null) {
            throw new IllegalArgumentException("caseValue cannot be null");
        }
        return new GotoStatement(span, Target.CASE, null, caseValue);
    }

    public static GotoStatement toDefault(TextSpan span) {
        return new GotoStatement(span, Target.DEFAULT, null, null);
    }

    public Target target() {
        return target;
    }

    /**
     * The label jumped to, or null for {@code goto case} and {@code goto default}.
     */
    public String label() {
        return label;
    }

    /**
     * The case value of {@code goto case}, otherwise null.
     */
    public Expression caseValue() {
        return caseValue;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.GOTO;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(caseValue);
    }
}
