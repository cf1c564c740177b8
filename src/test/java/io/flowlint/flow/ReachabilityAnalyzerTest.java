package io.flowlint.flow;

import io.flowlint.parse.ParseException;
import io.flowlint.parse.Parser;
import io.flowlint.semantic.ScopeResolver;
import io.flowlint.semantic.Symbol;
import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.ExpressionStatement;
import io.flowlint.syntax.GotoStatement;
import io.flowlint.syntax.MethodDeclaration;
import io.flowlint.syntax.Statement;
import io.flowlint.syntax.SwitchSection;
import io.flowlint.syntax.SyntaxTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReachabilityAnalyzerTest {

    private ReachabilityAnalyzer analyzer;
    private SyntaxTree tree;

    @BeforeEach
    void setUp() {
        analyzer = new ReachabilityAnalyzer();
    }

    @Test
    void analyze_bodyEntryIsReachable() throws ParseException {
        BlockStatement body = body("Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(body)).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isEndpointReachable(body)).isTrue();
    }

    @Test
    void analyze_statementAfterReturnIsUnreachable() throws ParseException {
        BlockStatement body = body("return; Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("return;"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
        assertThat(result.isEndpointReachable(body)).isFalse();
    }

    @Test
    void analyze_throwIsTerminal() throws ParseException {
        BlockStatement body = body("throw new Exception(); Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_infiniteWhileWithoutBreak() throws ParseException {
        BlockStatement body = body("while (true) { Bar(); } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Bar();"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
        assertThat(result.isEndpointReachable(body)).isFalse();
    }

    @Test
    void analyze_infiniteWhileWithBreak() throws ParseException {
        BlockStatement body = body("while (true) { break; } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isEndpointReachable(body)).isTrue();
    }

    @Test
    void analyze_parenthesizedTrueConditionIsInfinite() throws ParseException {
        BlockStatement body = body("while ((true)) { } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_whileWithUnknownConditionCompletes() throws ParseException {
        BlockStatement body = body("while (x) { return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_whileFalseBodyIsUnreachable() throws ParseException {
        BlockStatement body = body("while (false) { Bar(); } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Bar();"))).isFalse();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_forWithoutConditionIsInfinite() throws ParseException {
        BlockStatement body = body("for (int i = 0; ; i++) { Bar(); } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_forWithConditionCompletes() throws ParseException {
        BlockStatement body = body("for (int i = 0; i < 10; i++) { return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_doWhileTrueWithoutBreak() throws ParseException {
        BlockStatement body = body("do { Bar(); } while (true); Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_doWhileConditionReachedOnlyThroughContinue() throws ParseException {
        BlockStatement reachedByContinue = body("do { if (x) continue; return; } while (y); Foo();");
        assertThat(analyzer.analyze(reachedByContinue).isReachable(statement("Foo();"))).isTrue();

        BlockStatement neverReached = body("do { return; } while (y); Foo();");
        assertThat(analyzer.analyze(neverReached).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_ifWithBothBranchesReturning() throws ParseException {
        BlockStatement body = body("if (x) return; else return; Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_ifWithoutElseCompletes() throws ParseException {
        BlockStatement body = body("if (x) return; Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_foreachCompletesEvenIfBodyReturns() throws ParseException {
        BlockStatement body = body("foreach (var item in items) { return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_switchWithDefaultAndAllSectionsReturning() throws ParseException {
        BlockStatement body = body("switch (x) { case 1: return; default: return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_switchWithoutDefaultCompletes() throws ParseException {
        BlockStatement body = body("switch (x) { case 1: return; case 2: return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_switchBreakReachesEndpoint() throws ParseException {
        BlockStatement body = body("switch (x) { case 1: break; default: return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_continueInsideSwitchTargetsEnclosingLoop() throws ParseException {
        BlockStatement body = body("while (true) { switch (x) { case 1: continue; default: break; } } Foo();");

        // the break leaves the switch, not the loop
        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_breakTargetsInnermostLoop() throws ParseException {
        BlockStatement body = body("while (true) { while (true) { break; } Bar(); } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Bar();"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_tryReturningAndCatchCompleting() throws ParseException {
        BlockStatement body = body("try { return; } catch (Exception e) { Log(e); } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_tryAndCatchReturning() throws ParseException {
        BlockStatement body = body("try { return; } catch { throw; } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("throw;"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_finallyThatNeverCompletesDiscardsJumps() throws ParseException {
        BlockStatement body = body("while (true) { try { break; } finally { while (true) { } } } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_breakThroughCompletingFinally() throws ParseException {
        BlockStatement body = body("while (true) { try { break; } finally { Bar(); } } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Bar();"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_lockEndpointIsBodyEndpoint() throws ParseException {
        BlockStatement body = body("lock (gate) { return; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_usingEndpointIsBodyEndpoint() throws ParseException {
        BlockStatement body = body("using (var s = Open()) { Bar(); } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_forwardGotoMakesLabelReachable() throws ParseException {
        BlockStatement body = body("goto end; Bar(); end: Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Bar();"))).isFalse();
        assertThat(result.isReachable(statement("end: Foo();"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isEndpointReachable(body)).isTrue();
    }

    @Test
    void analyze_backwardGotoLoopsForever() throws ParseException {
        BlockStatement body = body("start: Foo(); goto start;");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isEndpointReachable(body)).isFalse();
    }

    @Test
    void analyze_labelReachedOnlyFromLaterLabel() throws ParseException {
        BlockStatement body = body("return; first: Bar(); goto done; second: goto first; done: Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        // nothing jumps to "second", so neither label is reachable
        assertThat(result.isReachable(statement("Bar();"))).isFalse();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_gotoChainResolvesToFixedPoint() throws ParseException {
        BlockStatement body = body("goto second; first: Bar(); goto done; second: goto first; done: Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Bar();"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_unreachableGotoDoesNotReachLabel() throws ParseException {
        BlockStatement body = body("return; goto end; end: Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_addingLabelsAndGotosNeverShrinksReachability() throws ParseException {
        Set<String> before = reachableExpressionTexts(body("Foo(); if (x) return; Bar(); while (y) { Baz(); }"));
        Set<String> after = reachableExpressionTexts(
                body("Foo(); if (x) goto skip; Bar(); skip: while (y) { Baz(); goto again; again: Qux(); }"));

        assertThat(after).containsAll(before);
    }

    @Test
    void analyze_reachableStatementsInDocumentOrder() throws ParseException {
        BlockStatement body = body("Foo(); if (x) { Bar(); } Baz();");

        List<String> texts = analyzer.analyze(body).reachableStatements().stream()
                .filter(s -> s instanceof ExpressionStatement)
                .map(tree::textOf)
                .toList();

        assertThat(texts).containsExactly("Foo();", "Bar();", "Baz();");
    }

    @Test
    void analyze_lambdaBodiesAreNotPartOfTheEnclosingBody() throws ParseException {
        BlockStatement body = body("Action a = () => { return; }; Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isReachable(statement("return;"))).isFalse();
    }

    @Test
    void analyze_recursiveCallStopsPropagation() throws ParseException {
        tree = Parser.parse("class C { void M() { M(); Foo(); } }");
        MethodDeclaration method = tree.root().descendantsOfType(MethodDeclaration.class).get(0);

        ReachabilityResult result = analyzer.analyze(method.body(), classifierFor(method));

        assertThat(result.isReachable(statement("M();"))).isTrue();
        assertThat(result.isRecursive(statement("M();"))).isTrue();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
        assertThat(result.isEndpointReachable(method.body())).isFalse();
    }

    @Test
    void analyze_recursionIgnoredWithoutClassifier() throws ParseException {
        tree = Parser.parse("class C { void M() { M(); Foo(); } }");
        MethodDeclaration method = tree.root().descendantsOfType(MethodDeclaration.class).get(0);

        ReachabilityResult result = analyzer.analyze(method.body());

        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.recursiveStatements()).isEmpty();
    }

    @Test
    void analyze_recursionInShortCircuitRightOperandIsConditional() throws ParseException {
        tree = Parser.parse("class C { bool M(bool b) { if (b && M(b)) { } Foo(); return b; } }");
        MethodDeclaration method = tree.root().descendantsOfType(MethodDeclaration.class).get(0);

        ReachabilityResult result = analyzer.analyze(method.body(), classifierFor(method));

        assertThat(result.isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void analyze_recursionInConditionStopsBranches() throws ParseException {
        tree = Parser.parse("class C { bool M(bool b) { while (M(b)) { Bar(); } Foo(); return b; } }");
        MethodDeclaration method = tree.root().descendantsOfType(MethodDeclaration.class).get(0);

        ReachabilityResult result = analyzer.analyze(method.body(), classifierFor(method));

        assertThat(result.isReachable(statement("Bar();"))).isFalse();
        assertThat(result.isReachable(statement("Foo();"))).isFalse();
    }

    @Test
    void analyze_gotoLeavingTryIsDiscardedByEndlessFinally() throws ParseException {
        BlockStatement body = body("try { goto done; } finally { while (true) { } } done: return;");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("done: return;"))).isFalse();
        assertThat(result.isEndpointReachable(body)).isFalse();
    }

    @Test
    void analyze_gotoWithinTrySurvivesEndlessFinally() throws ParseException {
        BlockStatement body = body(
                "try { goto inner; Skipped(); inner: Foo(); } finally { while (true) { } } Bar();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Skipped();"))).isFalse();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isReachable(statement("Bar();"))).isFalse();
    }

    @Test
    void analyze_gotoLeavingTryWithCompletingFinally() throws ParseException {
        BlockStatement body = body("try { goto done; } finally { Foo(); } Skipped(); done: Bar();");

        assertThat(reachableExpressionTexts(body)).containsExactlyInAnyOrder("Foo();", "Bar();");
    }

    @Test
    void analyze_gotoCaseIsTerminal() throws ParseException {
        BlockStatement body = body(
                "switch (x) { case 1: goto case 2; Skipped(); case 2: Foo(); break; default: goto default; } Bar();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Skipped();"))).isFalse();
        assertThat(result.isReachable(statement("Foo();"))).isTrue();
        assertThat(result.isReachable(statement("Bar();"))).isTrue();
    }

    @Test
    void analyze_switchLoopingThroughGotoCaseNeverEnds() throws ParseException {
        BlockStatement body = body("switch (x) { case 1: goto default; default: goto case 1; } Foo();");

        ReachabilityResult result = analyzer.analyze(body);

        assertThat(result.isReachable(statement("Foo();"))).isFalse();
        assertThat(result.isEndpointReachable(body)).isFalse();
    }

    @Test
    void analyze_gotoCaseWithoutMatchingSectionIsDropped() throws ParseException {
        BlockStatement body = body("switch (x) { case 1: goto case 3; } Foo();");

        assertThat(analyzer.analyze(body).isReachable(statement("Foo();"))).isTrue();
    }

    @Test
    void sameConstant_comparesCaseValuesStructurally() throws ParseException {
        body("switch (x) { case Color.Red: goto case (Color.Red); case -1: goto case -1; case 2: goto case \"2\"; }");
        List<SwitchSection> sections = tree.root().descendantsOfType(SwitchSection.class);
        List<GotoStatement> jumps = tree.root().descendantsOfType(GotoStatement.class);

        assertThat(ReachabilityAnalyzer.sameConstant(sections.get(0).caseLabels().get(0), jumps.get(0).caseValue()))
                .isTrue();
        assertThat(ReachabilityAnalyzer.sameConstant(sections.get(1).caseLabels().get(0), jumps.get(1).caseValue()))
                .isTrue();
        assertThat(ReachabilityAnalyzer.sameConstant(sections.get(2).caseLabels().get(0), jumps.get(2).caseValue()))
                .isFalse();
    }

    @Test
    void analyze_rejectsNullBody() {
        assertThatThrownBy(() -> analyzer.analyze(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private BlockStatement body(String statements) throws ParseException {
        tree = Parser.parse("class C { void M() { " + statements + " } }");
        return tree.root().descendantsOfType(MethodDeclaration.class).get(0).body();
    }

    private Statement statement(String text) {
        return tree.root().descendantsOfType(Statement.class).stream()
                .filter(s -> tree.textOf(s).equals(text))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No statement '" + text + "'"));
    }

    private Set<String> reachableExpressionTexts(BlockStatement body) {
        return analyzer.analyze(body).reachableStatements().stream()
                .filter(s -> s instanceof ExpressionStatement)
                .map(tree::textOf)
                .collect(Collectors.toSet());
    }

    private RecursionClassifier classifierFor(MethodDeclaration method) {
        ScopeResolver resolver = new ScopeResolver(tree);
        Symbol symbol = resolver.resolve(method).orElseThrow();
        return RecursionClassifier.forMember(resolver, symbol, AccessorRole.NONE);
    }
}
