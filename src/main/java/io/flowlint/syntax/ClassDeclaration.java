package io.flowlint.syntax;

import java.util.List;

public final class ClassDeclaration extends SyntaxNode {

    private final String name;
    private final TextSpan nameSpan;
    private final List<MemberDeclaration> members;

    public ClassDeclaration(TextSpan span, String name, TextSpan nameSpan, List<MemberDeclaration> members) {
        super(span);
        this.name = name;
        this.nameSpan = nameSpan;
        this.members = adoptAll(members);
    }

    public String name() {
        return name;
    }

    public TextSpan nameSpan() {
        return nameSpan;
    }

    public List<MemberDeclaration> members() {
        return members;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(members);
    }
}
