package io.flowlint.rules;

import io.flowlint.flow.ReachabilityAnalyzer;
import io.flowlint.flow.ReachabilityResult;
import io.flowlint.flow.RecursionClassifier;
import io.flowlint.model.Issue;
import io.flowlint.semantic.ScopeResolver;
import io.flowlint.semantic.SymbolResolver;
import io.flowlint.suppression.SuppressionTracker;
import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.SyntaxTree;
import io.flowlint.syntax.TextSpan;

/**
 * Everything a rule may consult while inspecting one file. Built once per file and
 * shared by the rules that run on it; nothing in it outlives the file.
 */
public final class AnalysisContext {

    private final SyntaxTree tree;
    private final SymbolResolver resolver;
    private final SuppressionTracker suppressions;
    private final ReachabilityAnalyzer reachabilityAnalyzer = new ReachabilityAnalyzer();

    public AnalysisContext(SyntaxTree tree, SymbolResolver resolver) {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        this.tree = tree;
        this.resolver = resolver;
        this.suppressions = SuppressionTracker.scan(tree);
    }

    /**
     * Creates a context with the default scope-based resolver.
     */
    public static AnalysisContext of(SyntaxTree tree) {
        return new AnalysisContext(tree, new ScopeResolver(tree));
    }

    public SyntaxTree tree() {
        return tree;
    }

    public String text() {
        return tree.text();
    }

    public SymbolResolver resolver() {
        return resolver;
    }

    public SuppressionTracker suppressions() {
        return suppressions;
    }

    public ReachabilityResult reachability(BlockStatement body, RecursionClassifier classifier) {
        return reachabilityAnalyzer.analyze(body, classifier);
    }

    /**
     * Starts an issue of the given rule anchored at a span of this file.
     */
    public Issue.Builder issue(Rule rule, TextSpan anchor) {
        return Issue.builder()
                .ruleName(rule.name())
                .severity(rule.severity())
                .span(anchor, tree.text());
    }

    /**
     * Whether an issue of the rule at the offset is inside a suppression region for the
     * rule's name or any of its aliases.
     */
    public boolean isSuppressed(Rule rule, int offset) {
        if (suppressions.isSuppressed(rule.name(), offset)) {
            return true;
        }
        return rule.aliases().stream().anyMatch(alias -> suppressions.isSuppressed(alias, offset));
    }
}
