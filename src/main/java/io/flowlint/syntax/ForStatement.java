package io.flowlint.syntax;

import java.util.List;

/**
 * {@code for (init; condition; iterators) body}. The initializer is either a local
 * declaration or a list of expressions; the condition may be omitted.
 */
public final class ForStatement extends Statement {

    private final LocalDeclarationStatement declaration;
    private final List<Expression> initializers;
    private final Expression condition;
    private final List<Expression> iterators;
    private final Statement body;

    public ForStatement(TextSpan span, LocalDeclarationStatement declaration, List<Expression> initializers,
                        Expression condition, List<Expression> iterators, Statement body) {
        super(span);
        this.declaration = adopt(declaration);
        this.initializers = adoptAll(initializers);
        this.condition = adopt(condition);
        this.iterators = adoptAll(iterators);
        this.body = adopt(body);
    }

    public LocalDeclarationStatement declaration() {
        return declaration;
    }

    public List<Expression> initializers() {
        return initializers;
    }

    /**
     * Returns the loop condition, or null when omitted.
     */
    public Expression condition() {
        return condition;
    }

    public List<Expression> iterators() {
        return iterators;
    }

    public Statement body() {
        return body;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.FOR;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(declaration, initializers, condition, iterators, body);
    }
}
