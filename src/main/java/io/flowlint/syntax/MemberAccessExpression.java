package io.flowlint.syntax;

import java.util.List;

/**
 * {@code target.member}.
 */
public final class MemberAccessExpression extends Expression {

    private final Expression target;
    private final String memberName;
    private final TextSpan memberNameSpan;

    public MemberAccessExpression(TextSpan span, Expression target, String memberName, TextSpan memberNameSpan) {
        super(span);
        this.target = adopt(target);
        this.memberName = memberName;
        this.memberNameSpan = memberNameSpan;
    }

    public Expression target() {
        return target;
    }

    public String memberName() {
        return memberName;
    }

    public TextSpan memberNameSpan() {
        return memberNameSpan;
    }

    public boolean isThisQualified() {
        return target instanceof ThisExpression;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.MEMBER_ACCESS;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(target);
    }
}
