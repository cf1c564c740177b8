package io.flowlint.syntax;

import java.util.List;
import java.util.Set;

public final class FieldDeclaration extends MemberDeclaration {

    private final List<VariableDeclarator> variables;

    public FieldDeclaration(TextSpan span, Set<String> modifiers, String typeName, List<VariableDeclarator> variables) {
        super(span, modifiers, typeName);
        this.variables = adoptAll(variables);
    }

    public List<VariableDeclarator> variables() {
        return variables;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(variables);
    }
}
