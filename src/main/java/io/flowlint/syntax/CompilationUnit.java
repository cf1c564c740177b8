package io.flowlint.syntax;

import java.util.List;

/**
 * Root of a syntax tree.
 */
public final class CompilationUnit extends SyntaxNode {

    private final List<ClassDeclaration> classes;

    public CompilationUnit(TextSpan span, List<ClassDeclaration> classes) {
        super(span);
        this.classes = adoptAll(classes);
    }

    public List<ClassDeclaration> classes() {
        return classes;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(classes);
    }
}
