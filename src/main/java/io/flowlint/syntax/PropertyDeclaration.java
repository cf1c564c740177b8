package io.flowlint.syntax;

import java.util.List;
import java.util.Set;

public final class PropertyDeclaration extends MemberDeclaration {

    private final String name;
    private final TextSpan nameSpan;
    private final List<Accessor> accessors;

    public PropertyDeclaration(TextSpan span, Set<String> modifiers, String typeName, String name,
                               TextSpan nameSpan, List<Accessor> accessors) {
        super(span, modifiers, typeName);
        this.name = name;
        this.nameSpan = nameSpan;
        this.accessors = adoptAll(accessors);
    }

    public String name() {
        return name;
    }

    public TextSpan nameSpan() {
        return nameSpan;
    }

    public List<Accessor> accessors() {
        return accessors;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(accessors);
    }
}
