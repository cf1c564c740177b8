package io.flowlint.flow;

import io.flowlint.semantic.Symbol;
import io.flowlint.semantic.SymbolKind;
import io.flowlint.semantic.SymbolResolver;
import io.flowlint.syntax.AssignmentExpression;
import io.flowlint.syntax.BinaryExpression;
import io.flowlint.syntax.ConditionalExpression;
import io.flowlint.syntax.ElementAccessExpression;
import io.flowlint.syntax.Expression;
import io.flowlint.syntax.IdentifierExpression;
import io.flowlint.syntax.InvocationExpression;
import io.flowlint.syntax.MemberAccessExpression;
import io.flowlint.syntax.ObjectCreationExpression;
import io.flowlint.syntax.ParenthesizedExpression;
import io.flowlint.syntax.SyntaxNode;
import io.flowlint.syntax.UnaryExpression;

import java.util.Optional;

/**
 * Decides whether evaluating an expression re-enters the member whose body is being
 * analyzed. A statement that unconditionally re-enters its own member never completes,
 * so the {@link ReachabilityAnalyzer} stops propagating control flow at it.
 * <p>
 * Pure function of the resolver answers; holds no mutable state.
 */
public final class RecursionClassifier {

    private static final RecursionClassifier NONE = new RecursionClassifier(null, null, AccessorRole.NONE);

    private final SymbolResolver resolver;
    private final Symbol member;
    private final AccessorRole role;

    private RecursionClassifier(SymbolResolver resolver, Symbol member, AccessorRole role) {
        this.resolver = resolver;
        this.member = member;
        this.role = role;
    }

    /**
     * A classifier that never reports recursion, for bodies without a named member
     * such as lambdas and anonymous methods.
     */
    public static RecursionClassifier none() {
        return NONE;
    }

    /**
     * @param resolver resolver for the analyzed tree
     * @param member   the member owning the body; null behaves like {@link #none()}
     * @param role     which accessor of the member the body implements
     */
    public static RecursionClassifier forMember(SymbolResolver resolver, Symbol member, AccessorRole role) {
        if (member == null) {
            return NONE;
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        return new RecursionClassifier(resolver, member, role == null ? AccessorRole.NONE : role);
    }

    /**
     * Classifies a single self-referencing node: an identifier, member access or invocation.
     */
    public boolean isRecursive(Expression node) {
        if (member == null) {
            return false;
        }
        if (!(node instanceof IdentifierExpression)
                && !(node instanceof MemberAccessExpression)
                && !(node instanceof InvocationExpression)) {
            return false;
        }
        Optional<Symbol> resolved = resolver.resolve(node);
        if (resolved.isEmpty() || !resolved.get().equals(member)) {
            return false;
        }
        // A method name on its own is a method group; the invocation around it is classified instead.
        if (resolved.get().kind() == SymbolKind.METHOD && !(node instanceof InvocationExpression)) {
            return false;
        }

        SyntaxNode parent = node.parent();
        if (parent instanceof AssignmentExpression assignment && assignment.left() == node) {
            return switch (role) {
                case ADD -> assignment.operator() == AssignmentExpression.Operator.ADD;
                case REMOVE -> assignment.operator() == AssignmentExpression.Operator.SUBTRACT;
                case GETTER -> assignment.operator() != AssignmentExpression.Operator.ASSIGN;
                case NONE, SETTER -> true;
            };
        }
        if (parent instanceof UnaryExpression unary && unary.operator().isIncrementOrDecrement()) {
            return true;
        }
        return role == AccessorRole.NONE || role == AccessorRole.GETTER;
    }

    /**
     * Returns true if evaluating the expression always reaches a recursive access.
     * Right operands of short-circuit operators count only through their left operand,
     * a conditional only if its condition or both branches recurse, and lambda bodies
     * never, since they are not executed where they are written.
     */
    public boolean evaluatesRecursively(Expression expression) {
        if (member == null || expression == null) {
            return false;
        }
        return switch (expression.expressionKind()) {
            case THIS, LITERAL, LAMBDA, ANONYMOUS_METHOD -> false;
            case IDENTIFIER -> isRecursive(expression);
            case MEMBER_ACCESS -> evaluatesRecursively(((MemberAccessExpression) expression).target())
                    || isRecursive(expression);
            case INVOCATION -> {
                InvocationExpression invocation = (InvocationExpression) expression;
                yield evaluatesRecursively(invocation.target())
                        || invocation.arguments().stream().anyMatch(this::evaluatesRecursively)
                        || isRecursive(invocation);
            }
            case ELEMENT_ACCESS -> {
                ElementAccessExpression access = (ElementAccessExpression) expression;
                yield evaluatesRecursively(access.target())
                        || access.indices().stream().anyMatch(this::evaluatesRecursively);
            }
            case ASSIGNMENT -> {
                AssignmentExpression assignment = (AssignmentExpression) expression;
                yield evaluatesRecursively(assignment.left()) || evaluatesRecursively(assignment.right());
            }
            case UNARY -> evaluatesRecursively(((UnaryExpression) expression).operand());
            case BINARY -> {
                BinaryExpression binary = (BinaryExpression) expression;
                yield evaluatesRecursively(binary.left())
                        || (!binary.operator().isShortCircuit() && evaluatesRecursively(binary.right()));
            }
            case CONDITIONAL -> {
                ConditionalExpression conditional = (ConditionalExpression) expression;
                yield evaluatesRecursively(conditional.condition())
                        || (evaluatesRecursively(conditional.whenTrue()) && evaluatesRecursively(conditional.whenFalse()));
            }
            case PARENTHESIZED -> evaluatesRecursively(((ParenthesizedExpression) expression).expression());
            case OBJECT_CREATION -> ((ObjectCreationExpression) expression).arguments().stream()
                    .anyMatch(this::evaluatesRecursively);
        };
    }
}
