package io.flowlint.syntax;

import java.util.List;
import java.util.Set;

public final class MethodDeclaration extends MemberDeclaration {

    private final String name;
    private final TextSpan nameSpan;
    private final List<ParameterDeclaration> parameters;
    private final BlockStatement body;

    /**
     * @param body the method body, or null for abstract, extern and partial declarations
     */
    public MethodDeclaration(TextSpan span, Set<String> modifiers, String returnType, String name,
                             TextSpan nameSpan, List<ParameterDeclaration> parameters, BlockStatement body) {
        super(span, modifiers, returnType);
        this.name = name;
        this.nameSpan = nameSpan;
        this.parameters = adoptAll(parameters);
        this.body = adopt(body);
    }

    public String name() {
        return name;
    }

    public TextSpan nameSpan() {
        return nameSpan;
    }

    public List<ParameterDeclaration> parameters() {
        return parameters;
    }

    public BlockStatement body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public List<SyntaxNode> children() {
        return nodes(parameters, body);
    }
}
