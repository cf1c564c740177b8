package io.flowlint.syntax;

import java.util.Set;

/**
 * A member of a class: field, method, property or event.
 */
public abstract class MemberDeclaration extends SyntaxNode {

    private final Set<String> modifiers;
    private final String typeName;

    protected MemberDeclaration(TextSpan span, Set<String> modifiers, String typeName) {
        super(span);
        this.modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        this.typeName = typeName;
    }

    public Set<String> modifiers() {
        return modifiers;
    }

    public boolean isStatic() {
        return modifiers.contains("static");
    }

    /**
     * Declared type, or the return type for methods.
     */
    public String typeName() {
        return typeName;
    }
}
