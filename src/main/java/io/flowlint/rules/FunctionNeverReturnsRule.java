package io.flowlint.rules;

import io.flowlint.flow.AccessorRole;
import io.flowlint.flow.ReachabilityResult;
import io.flowlint.flow.RecursionClassifier;
import io.flowlint.model.Issue;
import io.flowlint.model.Severity;
import io.flowlint.semantic.Symbol;
import io.flowlint.syntax.Accessor;
import io.flowlint.syntax.AnonymousMethodExpression;
import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.LambdaExpression;
import io.flowlint.syntax.MethodDeclaration;
import io.flowlint.syntax.Statement;
import io.flowlint.syntax.StatementKind;
import io.flowlint.syntax.SyntaxNode;
import io.flowlint.syntax.TextSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds function bodies that can neither fall off their end nor leave through a
 * {@code return}, {@code throw} or {@code yield break}: infinite loops, and bodies whose
 * every path re-enters the function itself.
 * <p>
 * Checks methods, property and event accessors, anonymous methods and block-bodied
 * lambdas. Constructors and bodiless declarations are skipped.
 */
public class FunctionNeverReturnsRule implements Rule {

    public static final String NAME = "FunctionNeverReturns";
    public static final String MESSAGE_FORMAT = "%s never reaches its end or a 'return' statement.";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Detects functions whose end and return statements are all unreachable";
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }

    @Override
    public List<Issue> inspect(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        SyntaxNode root = context.tree().root();

        for (MethodDeclaration method : root.descendantsOfType(MethodDeclaration.class)) {
            if (method.typeName() == null || !method.hasBody()) {
                continue;
            }
            Optional<Symbol> symbol = context.resolver().resolve(method);
            RecursionClassifier classifier = RecursionClassifier.forMember(
                    context.resolver(), symbol.orElse(null), AccessorRole.NONE);
            check(context, method.body(), classifier, "Method", method.nameSpan()).ifPresent(issues::add);
        }

        for (Accessor accessor : root.descendantsOfType(Accessor.class)) {
            if (accessor.body() == null) {
                continue;
            }
            Optional<Symbol> owner = context.resolver().resolve(accessor);
            RecursionClassifier classifier = RecursionClassifier.forMember(
                    context.resolver(), owner.orElse(null), AccessorRole.of(accessor.kind()));
            check(context, accessor.body(), classifier, "Accessor", accessor.keywordSpan()).ifPresent(issues::add);
        }

        for (AnonymousMethodExpression anonymous : root.descendantsOfType(AnonymousMethodExpression.class)) {
            check(context, anonymous.body(), RecursionClassifier.none(), "Delegate", anonymous.delegateKeywordSpan())
                    .ifPresent(issues::add);
        }

        for (LambdaExpression lambda : root.descendantsOfType(LambdaExpression.class)) {
            if (lambda.body() instanceof BlockStatement block) {
                check(context, block, RecursionClassifier.none(), "Lambda expression", lambda.arrowSpan())
                        .ifPresent(issues::add);
            }
        }

        issues.sort(Comparator.comparingInt(issue -> issue.span().start()));
        return issues;
    }

    private Optional<Issue> check(AnalysisContext context,
                                  BlockStatement body,
                                  RecursionClassifier classifier,
                                  String kind,
                                  TextSpan anchor) {
        ReachabilityResult result = context.reachability(body, classifier);
        if (result.isEndpointReachable(body)) {
            return Optional.empty();
        }
        for (Statement statement : result.reachableStatements()) {
            if (isExit(statement) && !result.isRecursive(statement)) {
                return Optional.empty();
            }
        }
        return Optional.of(context.issue(this, anchor)
                .message(String.format(MESSAGE_FORMAT, kind))
                .build());
    }

    private static boolean isExit(Statement statement) {
        StatementKind kind = statement.statementKind();
        return kind == StatementKind.RETURN || kind == StatementKind.THROW || kind == StatementKind.YIELD_BREAK;
    }
}
