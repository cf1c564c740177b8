package io.flowlint.syntax;

import java.util.List;

/**
 * A parsed source file: its text, the root node and the comment trivia.
 */
public record SyntaxTree(String text, CompilationUnit root, List<Comment> comments) {

    public SyntaxTree {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    /**
     * Returns true if the node belongs to this tree.
     */
    public boolean contains(SyntaxNode node) {
        return node != null && node.root() == root;
    }

    public String textOf(SyntaxNode node) {
        return text.substring(node.start(), node.end());
    }

    public String textOf(TextSpan span) {
        return text.substring(span.start(), span.end());
    }
}
