package io.flowlint.semantic;

import io.flowlint.syntax.Accessor;
import io.flowlint.syntax.AnonymousMethodExpression;
import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.CatchClause;
import io.flowlint.syntax.ClassDeclaration;
import io.flowlint.syntax.EventDeclaration;
import io.flowlint.syntax.FieldDeclaration;
import io.flowlint.syntax.ForStatement;
import io.flowlint.syntax.ForeachStatement;
import io.flowlint.syntax.IdentifierExpression;
import io.flowlint.syntax.InvocationExpression;
import io.flowlint.syntax.LabeledStatement;
import io.flowlint.syntax.LambdaExpression;
import io.flowlint.syntax.LocalDeclarationStatement;
import io.flowlint.syntax.MemberAccessExpression;
import io.flowlint.syntax.MemberDeclaration;
import io.flowlint.syntax.MethodDeclaration;
import io.flowlint.syntax.ParameterDeclaration;
import io.flowlint.syntax.PropertyDeclaration;
import io.flowlint.syntax.Statement;
import io.flowlint.syntax.SwitchSection;
import io.flowlint.syntax.SwitchStatement;
import io.flowlint.syntax.SyntaxNode;
import io.flowlint.syntax.SyntaxTree;
import io.flowlint.syntax.UsingStatement;
import io.flowlint.syntax.VariableDeclarator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Name-based resolver for a single syntax tree.
 * <p>
 * Locals are visible in the whole block that declares them, so a local declared after a
 * use still shadows a member of the same name. Members are looked up in the enclosing
 * class only; inherited members are unknown and resolve to nothing. Member accesses on
 * anything other than {@code this} are not resolved.
 */
public class ScopeResolver implements SymbolResolver {

    private static final int ANY_ARITY = -1;

    private final SyntaxTree tree;

    public ScopeResolver(SyntaxTree tree) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        this.tree = tree;
    }

    @Override
    public Optional<Symbol> resolve(SyntaxNode node) {
        requireInTree(node);

        if (node instanceof IdentifierExpression identifier) {
            return lookup(identifier.name(), identifier, invocationArity(identifier));
        }
        if (node instanceof MemberAccessExpression access) {
            if (!access.isThisQualified()) {
                return Optional.empty();
            }
            return access.ancestor(ClassDeclaration.class)
                    .flatMap(cls -> member(cls, access.memberName(), invocationArity(access)));
        }
        if (node instanceof InvocationExpression invocation) {
            return resolve(invocation.target())
                    .filter(symbol -> symbol.kind() == SymbolKind.METHOD);
        }
        if (node instanceof MethodDeclaration method) {
            return Optional.of(new Symbol(SymbolKind.METHOD, method.name(), method));
        }
        if (node instanceof PropertyDeclaration property) {
            return Optional.of(new Symbol(SymbolKind.PROPERTY, property.name(), property));
        }
        if (node instanceof EventDeclaration event) {
            return Optional.of(new Symbol(SymbolKind.EVENT, event.name(), event));
        }
        if (node instanceof Accessor accessor) {
            return resolve(accessor.parent());
        }
        if (node instanceof VariableDeclarator declarator) {
            SymbolKind kind = declarator.parent() instanceof FieldDeclaration ? SymbolKind.FIELD : SymbolKind.LOCAL;
            return Optional.of(new Symbol(kind, declarator.name(), declarator));
        }
        if (node instanceof ParameterDeclaration parameter) {
            return Optional.of(new Symbol(SymbolKind.PARAMETER, parameter.name(), parameter));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Symbol> lookup(String name, SyntaxNode position) {
        requireInTree(position);
        return lookup(name, position, invocationArity(position));
    }

    private Optional<Symbol> lookup(String name, SyntaxNode position, int arity) {
        for (SyntaxNode scope = position; scope != null; scope = scope.parent()) {
            Optional<Symbol> found = declaredIn(scope, name, arity);
            if (found.isPresent()) {
                return found;
            }
            if (scope instanceof ClassDeclaration) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<Symbol> declaredIn(SyntaxNode scope, String name, int arity) {
        if (scope instanceof BlockStatement block) {
            return locals(block.statements(), name);
        }
        if (scope instanceof SwitchStatement switchStatement) {
            for (SwitchSection section : switchStatement.sections()) {
                Optional<Symbol> found = locals(section.statements(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (scope instanceof ForStatement forStatement) {
            return forStatement.declaration() == null ? Optional.empty()
                    : locals(List.of(forStatement.declaration()), name);
        }
        if (scope instanceof UsingStatement using) {
            return using.declaration() == null ? Optional.empty() : locals(List.of(using.declaration()), name);
        }
        if (scope instanceof ForeachStatement foreach) {
            return local(foreach.variable(), name);
        }
        if (scope instanceof CatchClause catchClause) {
            return catchClause.variable() == null ? Optional.empty() : local(catchClause.variable(), name);
        }
        if (scope instanceof LambdaExpression lambda) {
            return parameter(lambda.parameters(), name);
        }
        if (scope instanceof AnonymousMethodExpression anonymous) {
            return parameter(anonymous.parameters(), name);
        }
        if (scope instanceof MethodDeclaration method) {
            return parameter(method.parameters(), name);
        }
        if (scope instanceof Accessor accessor) {
            if (accessor.kind().hasValueParameter() && "value".equals(name)) {
                return Optional.of(new Symbol(SymbolKind.PARAMETER, name, accessor));
            }
            return Optional.empty();
        }
        if (scope instanceof ClassDeclaration cls) {
            return member(cls, name, arity);
        }
        return Optional.empty();
    }

    private Optional<Symbol> locals(List<? extends Statement> statements, String name) {
        for (Statement statement : statements) {
            Statement unlabeled = statement;
            while (unlabeled instanceof LabeledStatement labeled) {
                unlabeled = labeled.statement();
            }
            if (unlabeled instanceof LocalDeclarationStatement declaration) {
                for (VariableDeclarator variable : declaration.variables()) {
                    if (variable.name().equals(name)) {
                        return Optional.of(new Symbol(SymbolKind.LOCAL, name, variable));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Symbol> local(VariableDeclarator variable, String name) {
        if (variable.name().equals(name)) {
            return Optional.of(new Symbol(SymbolKind.LOCAL, name, variable));
        }
        return Optional.empty();
    }

    private Optional<Symbol> parameter(List<ParameterDeclaration> parameters, String name) {
        for (ParameterDeclaration parameter : parameters) {
            if (parameter.name().equals(name)) {
                return Optional.of(new Symbol(SymbolKind.PARAMETER, name, parameter));
            }
        }
        return Optional.empty();
    }

    /**
     * Finds a member by name. Overloaded methods are disambiguated by arity when the name
     * is called; an ambiguous method group resolves to nothing.
     */
    private Optional<Symbol> member(ClassDeclaration cls, String name, int arity) {
        List<MethodDeclaration> methods = new ArrayList<>();
        for (MemberDeclaration member : cls.members()) {
            if (member instanceof FieldDeclaration field) {
                for (VariableDeclarator variable : field.variables()) {
                    if (variable.name().equals(name)) {
                        return Optional.of(new Symbol(SymbolKind.FIELD, name, variable));
                    }
                }
            } else if (member instanceof PropertyDeclaration property && property.name().equals(name)) {
                return Optional.of(new Symbol(SymbolKind.PROPERTY, name, property));
            } else if (member instanceof EventDeclaration event && event.name().equals(name)) {
                return Optional.of(new Symbol(SymbolKind.EVENT, name, event));
            } else if (member instanceof MethodDeclaration method && name.equals(method.name())
                    && method.typeName() != null) {
                methods.add(method);
            }
        }
        if (arity != ANY_ARITY) {
            methods.removeIf(method -> method.parameters().size() != arity);
        }
        if (methods.size() == 1) {
            MethodDeclaration method = methods.get(0);
            return Optional.of(new Symbol(SymbolKind.METHOD, name, method));
        }
        return Optional.empty();
    }

    private static int invocationArity(SyntaxNode node) {
        if (node.parent() instanceof InvocationExpression invocation && invocation.target() == node) {
            return invocation.arguments().size();
        }
        return ANY_ARITY;
    }

    private void requireInTree(SyntaxNode node) {
        if (node == null) {
            throw new AnalysisException("Cannot resolve a null node");
        }
        if (!tree.contains(node)) {
            throw new AnalysisException("Node " + node + " does not belong to the analyzed syntax tree");
        }
    }
}
