package io.flowlint.syntax;

import java.util.List;

/**
 * {@code catch}, {@code catch (Type)} or {@code catch (Type name)} with its block.
 */
public final class CatchClause extends SyntaxNode {

    private final String typeName;
    private final VariableDeclarator variable;
    private final BlockStatement body;

    public CatchClause(TextSpan span, String typeName, VariableDeclarator variable, BlockStatement body) {
        super(span);
        this.typeName = typeName;
        this.variable = adopt(variable);
        this.body = adopt(body);
    }

    public String typeName() {
        return typeName;
    }

    public VariableDeclarator variable() {
        return variable;
    }

    public BlockStatement body() {
        return body;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(variable, body);
    }
}
