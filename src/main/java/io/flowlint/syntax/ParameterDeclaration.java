package io.flowlint.syntax;

import java.util.List;

public final class ParameterDeclaration extends SyntaxNode {

    private final String typeName;
    private final String name;

    /**
     * @param typeName declared type, or null for implicitly typed lambda parameters
     */
    public ParameterDeclaration(TextSpan span, String typeName, String name) {
        super(span);
        this.typeName = typeName;
        this.name = name;
    }

    public String typeName() {
        return typeName;
    }

    public String name() {
        return name;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
