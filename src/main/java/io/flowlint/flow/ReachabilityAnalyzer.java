package io.flowlint.flow;

import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.CatchClause;
import io.flowlint.syntax.DoWhileStatement;
import io.flowlint.syntax.Expression;
import io.flowlint.syntax.ExpressionStatement;
import io.flowlint.syntax.ForStatement;
import io.flowlint.syntax.ForeachStatement;
import io.flowlint.syntax.GotoStatement;
import io.flowlint.syntax.IdentifierExpression;
import io.flowlint.syntax.IfStatement;
import io.flowlint.syntax.LabeledStatement;
import io.flowlint.syntax.LiteralExpression;
import io.flowlint.syntax.LocalDeclarationStatement;
import io.flowlint.syntax.LockStatement;
import io.flowlint.syntax.MemberAccessExpression;
import io.flowlint.syntax.ParenthesizedExpression;
import io.flowlint.syntax.ReturnStatement;
import io.flowlint.syntax.Statement;
import io.flowlint.syntax.SwitchSection;
import io.flowlint.syntax.SwitchStatement;
import io.flowlint.syntax.SyntaxNode;
import io.flowlint.syntax.ThrowStatement;
import io.flowlint.syntax.TryStatement;
import io.flowlint.syntax.UnaryExpression;
import io.flowlint.syntax.UsingStatement;
import io.flowlint.syntax.VariableDeclarator;
import io.flowlint.syntax.WhileStatement;
import io.flowlint.syntax.YieldReturnStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes which statements of a body can execute and which statement endpoints can be
 * passed.
 * <p>
 * The analysis walks the statement tree once per pass. Jumps leaving a statement
 * ({@code break}, {@code continue}) are collected as pending exits and resolved by the
 * loop or switch they target. {@code goto} makes its label reachable, and {@code goto case}
 * or {@code goto default} the entry of the matching switch section. Since a target may
 * precede the jump, passes are repeated until the set of reached targets is stable. The
 * set only grows, so the iteration terminates after at most one pass per target.
 * <p>
 * Conditions are not evaluated except for the literals {@code true} and {@code false}
 * in loop headers. Statements that unconditionally re-enter the analyzed member, as
 * decided by the {@link RecursionClassifier}, are reachable but have no reachable endpoint.
 */
public class ReachabilityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    /**
     * Analyzes a body without recursion detection.
     */
    public ReachabilityResult analyze(BlockStatement body) {
        return analyze(body, RecursionClassifier.none());
    }

    public ReachabilityResult analyze(BlockStatement body, RecursionClassifier classifier) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        RecursionClassifier effective = classifier == null ? RecursionClassifier.none() : classifier;
        Map<String, LabeledStatement> labels = collectLabels(body);

        Set<String> forcedLabels = new HashSet<>();
        Set<SwitchSection> forcedSections = Collections.newSetFromMap(new IdentityHashMap<>());
        int passes = 0;
        while (true) {
            passes++;
            Pass pass = new Pass(effective, labels, forcedLabels, forcedSections);
            pass.visit(body, true);

            Set<String> reached = new HashSet<>(pass.gotoTargets);
            reached.retainAll(labels.keySet());
            if (forcedLabels.containsAll(reached) && forcedSections.containsAll(pass.sectionTargets)) {
                log.trace("Reachability of body at {} settled after {} pass(es)", body.span(), passes);
                return pass.result(body);
            }
            forcedLabels.addAll(reached);
            forcedSections.addAll(pass.sectionTargets);
        }
    }

    /**
     * Labels declared directly in the body, not in nested lambdas. Duplicate labels are
     * rejected by the compiler; the first declaration is kept.
     */
    private static Map<String, LabeledStatement> collectLabels(BlockStatement body) {
        Map<String, LabeledStatement> labels = new LinkedHashMap<>();
        Deque<Statement> work = new ArrayDeque<>();
        work.push(body);
        while (!work.isEmpty()) {
            Statement statement = work.pop();
            if (statement instanceof LabeledStatement labeled) {
                labels.putIfAbsent(labeled.label(), labeled);
            }
            for (var child : statement.children()) {
                if (child instanceof Statement nested) {
                    work.push(nested);
                } else if (child instanceof SwitchSection section) {
                    section.statements().forEach(work::push);
                } else if (child instanceof CatchClause catchClause) {
                    work.push(catchClause.body());
                }
            }
        }
        return labels;
    }

    static boolean isConstant(Expression condition, boolean value) {
        Expression unwrapped = unwrap(condition);
        if (unwrapped instanceof LiteralExpression literal) {
            return value ? literal.isTrue() : literal.isFalse();
        }
        return false;
    }

    /**
     * Structural equality of two case values, enough to match {@code goto case} against
     * literal, named and negated constants.
     */
    static boolean sameConstant(Expression first, Expression second) {
        Expression a = unwrap(first);
        Expression b = unwrap(second);
        if (a instanceof LiteralExpression x && b instanceof LiteralExpression y) {
            return x.kind() == y.kind() && x.text().equals(y.text());
        }
        if (a instanceof IdentifierExpression x && b instanceof IdentifierExpression y) {
            return x.name().equals(y.name());
        }
        if (a instanceof MemberAccessExpression x && b instanceof MemberAccessExpression y) {
            return x.memberName().equals(y.memberName()) && sameConstant(x.target(), y.target());
        }
        if (a instanceof UnaryExpression x && b instanceof UnaryExpression y) {
            return x.operator() == y.operator() && sameConstant(x.operand(), y.operand());
        }
        return false;
    }

    private static Expression unwrap(Expression expression) {
        Expression unwrapped = expression;
        while (unwrapped instanceof ParenthesizedExpression parenthesized) {
            unwrapped = parenthesized.expression();
        }
        return unwrapped;
    }

    private static boolean inside(Statement container, SyntaxNode node) {
        return node != null && container.span().contains(node.span());
    }

    private enum JumpKind {
        BREAK,
        CONTINUE
    }

    private record PendingJump(JumpKind kind, Statement jump, Statement target) {
    }

    /**
     * State of a single walk over the body.
     */
    private static final class Pass {

        private final RecursionClassifier classifier;
        private final Map<String, LabeledStatement> labels;
        private final Set<String> forcedLabels;
        private final Set<SwitchSection> forcedSections;

        private final List<Statement> reachable = new ArrayList<>();
        private final Map<Statement, Boolean> endpoints = new IdentityHashMap<>();
        private final Set<Statement> recursive = Collections.newSetFromMap(new IdentityHashMap<>());

        private List<PendingJump> pending = new ArrayList<>();
        private Set<String> gotoTargets = new HashSet<>();
        private Set<SwitchSection> sectionTargets = newSectionSet();
        private final Deque<Statement> breakTargets = new ArrayDeque<>();
        private final Deque<Statement> continueTargets = new ArrayDeque<>();
        private final Deque<SwitchStatement> switches = new ArrayDeque<>();

        Pass(RecursionClassifier classifier, Map<String, LabeledStatement> labels,
             Set<String> forcedLabels, Set<SwitchSection> forcedSections) {
            this.classifier = classifier;
            this.labels = labels;
            this.forcedLabels = forcedLabels;
            this.forcedSections = forcedSections;
        }

        private static Set<SwitchSection> newSectionSet() {
            return Collections.newSetFromMap(new IdentityHashMap<>());
        }

        ReachabilityResult result(BlockStatement body) {
            return new ReachabilityResult(body, reachable, endpoints, recursive);
        }

        /**
         * Visits a statement entered with the given reachability and returns whether its
         * endpoint is reachable.
         */
        boolean visit(Statement statement, boolean entered) {
            boolean live = entered
                    || (statement instanceof LabeledStatement labeled && forcedLabels.contains(labeled.label()));
            if (live) {
                reachable.add(statement);
            }
            boolean endpoint = switch (statement.statementKind()) {
                case BLOCK -> sequence(((BlockStatement) statement).statements(), live);
                case EXPRESSION -> live && !halts(statement, live, ((ExpressionStatement) statement).expression());
                case LOCAL_DECLARATION -> live && !halts(statement, live,
                        initializers((LocalDeclarationStatement) statement));
                case EMPTY -> live;
                case YIELD_RETURN -> live && !halts(statement, live, ((YieldReturnStatement) statement).expression());
                case IF -> visitIf((IfStatement) statement, live);
                case WHILE -> visitWhile((WhileStatement) statement, live);
                case DO_WHILE -> visitDoWhile((DoWhileStatement) statement, live);
                case FOR -> visitFor((ForStatement) statement, live);
                case FOREACH -> visitForeach((ForeachStatement) statement, live);
                case SWITCH -> visitSwitch((SwitchStatement) statement, live);
                case TRY -> visitTry((TryStatement) statement, live);
                case USING -> visitUsing((UsingStatement) statement, live);
                case LOCK -> {
                    LockStatement lock = (LockStatement) statement;
                    boolean inner = live && !halts(lock, live, lock.lockObject());
                    yield visit(lock.body(), inner);
                }
                case BREAK -> jump(JumpKind.BREAK, statement, live, breakTargets);
                case CONTINUE -> jump(JumpKind.CONTINUE, statement, live, continueTargets);
                case RETURN -> {
                    halts(statement, live, ((ReturnStatement) statement).expression());
                    yield false;
                }
                case THROW -> {
                    halts(statement, live, ((ThrowStatement) statement).expression());
                    yield false;
                }
                case YIELD_BREAK -> false;
                case GOTO -> {
                    if (live) {
                        jumpTo((GotoStatement) statement);
                    }
                    yield false;
                }
                case LABELED -> visit(((LabeledStatement) statement).statement(), live);
            };
            endpoints.put(statement, endpoint);
            return endpoint;
        }

        private boolean sequence(List<Statement> statements, boolean entered) {
            boolean live = entered;
            for (Statement statement : statements) {
                live = visit(statement, live);
            }
            return live;
        }

        private boolean visitIf(IfStatement statement, boolean live) {
            boolean inner = live && !halts(statement, live, statement.condition());
            boolean thenEnd = visit(statement.thenStatement(), inner);
            boolean elseEnd = statement.elseStatement() == null
                    ? inner
                    : visit(statement.elseStatement(), inner);
            return thenEnd || elseEnd;
        }

        private boolean visitWhile(WhileStatement statement, boolean live) {
            boolean inner = live && !halts(statement, live, statement.condition());
            enterLoop(statement);
            visit(statement.body(), inner && !isConstant(statement.condition(), false));
            boolean breaks = exitLoop(statement);
            return (inner && !isConstant(statement.condition(), true)) || breaks;
        }

        private boolean visitDoWhile(DoWhileStatement statement, boolean live) {
            enterLoop(statement);
            boolean bodyEnd = visit(statement.body(), live);
            boolean conditionReached = bodyEnd || continues(statement);
            boolean breaks = exitLoop(statement);
            boolean conditionEnd = conditionReached && !halts(statement, conditionReached, statement.condition());
            return (conditionEnd && !isConstant(statement.condition(), true)) || breaks;
        }

        private boolean visitFor(ForStatement statement, boolean live) {
            List<Expression> header = new ArrayList<>();
            if (statement.declaration() != null) {
                header.addAll(initializers(statement.declaration()));
            }
            header.addAll(statement.initializers());
            if (statement.condition() != null) {
                header.add(statement.condition());
            }
            boolean inner = live && !halts(statement, live, header);
            boolean infinite = statement.condition() == null || isConstant(statement.condition(), true);
            boolean bodyLive = inner && (statement.condition() == null || !isConstant(statement.condition(), false));

            enterLoop(statement);
            visit(statement.body(), bodyLive);
            boolean breaks = exitLoop(statement);
            return (inner && !infinite) || breaks;
        }

        private boolean visitForeach(ForeachStatement statement, boolean live) {
            boolean inner = live && !halts(statement, live, statement.collection());
            enterLoop(statement);
            visit(statement.body(), inner);
            boolean breaks = exitLoop(statement);
            return inner || breaks;
        }

        private boolean visitSwitch(SwitchStatement statement, boolean live) {
            boolean inner = live && !halts(statement, live, statement.expression());
            breakTargets.push(statement);
            switches.push(statement);
            boolean anySectionEnd = false;
            for (SwitchSection section : statement.sections()) {
                anySectionEnd |= sequence(section.statements(), inner || forcedSections.contains(section));
            }
            switches.pop();
            breakTargets.pop();
            boolean breaks = resolve(statement, JumpKind.BREAK);
            if (statement.hasDefaultSection()) {
                return anySectionEnd || breaks;
            }
            return inner || breaks;
        }

        private boolean visitTry(TryStatement statement, boolean live) {
            List<PendingJump> outerPending = pending;
            Set<String> outerGotos = gotoTargets;
            Set<SwitchSection> outerSections = sectionTargets;
            pending = new ArrayList<>();
            gotoTargets = new HashSet<>();
            sectionTargets = newSectionSet();

            boolean end = visit(statement.tryBlock(), live);
            for (CatchClause catchClause : statement.catchClauses()) {
                end |= visit(catchClause.body(), live);
            }

            List<PendingJump> exits = pending;
            Set<String> gotos = gotoTargets;
            Set<SwitchSection> sections = sectionTargets;
            pending = outerPending;
            gotoTargets = outerGotos;
            sectionTargets = outerSections;

            boolean finallyEnd = statement.finallyBlock() == null || visit(statement.finallyBlock(), live);
            if (!finallyEnd) {
                // Only jumps that stay inside the try survive a finally block that never completes.
                gotos.removeIf(label -> !inside(statement, labels.get(label)));
                sections.removeIf(section -> !inside(statement, section));
            }
            gotoTargets.addAll(gotos);
            sectionTargets.addAll(sections);
            if (!finallyEnd) {
                return false;
            }
            pending.addAll(exits);
            return end;
        }

        private boolean visitUsing(UsingStatement statement, boolean live) {
            List<Expression> resources = new ArrayList<>();
            if (statement.declaration() != null) {
                resources.addAll(initializers(statement.declaration()));
            }
            if (statement.resource() != null) {
                resources.add(statement.resource());
            }
            boolean inner = live && !halts(statement, live, resources);
            return visit(statement.body(), inner);
        }

        private boolean jump(JumpKind kind, Statement jump, boolean live, Deque<Statement> targets) {
            if (live && !targets.isEmpty()) {
                pending.add(new PendingJump(kind, jump, targets.peek()));
            }
            return false;
        }

        private void jumpTo(GotoStatement jump) {
            switch (jump.target()) {
                case LABEL -> gotoTargets.add(jump.label());
                case CASE, DEFAULT -> {
                    SwitchStatement target = switches.peek();
                    if (target == null) {
                        return;
                    }
                    for (SwitchSection section : target.sections()) {
                        boolean matches = jump.target() == GotoStatement.Target.DEFAULT
                                ? section.hasDefaultLabel()
                                : section.caseLabels().stream().anyMatch(value -> sameConstant(value, jump.caseValue()));
                        if (matches) {
                            sectionTargets.add(section);
                            return;
                        }
                    }
                }
            }
        }

        private void enterLoop(Statement loop) {
            breakTargets.push(loop);
            continueTargets.push(loop);
        }

        /**
         * Leaves a loop, dropping its continues and reporting whether any break reached it.
         */
        private boolean exitLoop(Statement loop) {
            breakTargets.pop();
            continueTargets.pop();
            resolve(loop, JumpKind.CONTINUE);
            return resolve(loop, JumpKind.BREAK);
        }

        private boolean continues(Statement loop) {
            return pending.stream().anyMatch(jump -> jump.kind() == JumpKind.CONTINUE && jump.target() == loop);
        }

        private boolean resolve(Statement target, JumpKind kind) {
            return pending.removeIf(jump -> jump.kind() == kind && jump.target() == target);
        }

        private boolean halts(Statement statement, boolean live, Expression expression) {
            return expression != null && halts(statement, live, List.of(expression));
        }

        private boolean halts(Statement statement, boolean live, List<Expression> expressions) {
            if (!live) {
                return false;
            }
            for (Expression expression : expressions) {
                if (classifier.evaluatesRecursively(expression)) {
                    recursive.add(statement);
                    return true;
                }
            }
            return false;
        }

        private static List<Expression> initializers(LocalDeclarationStatement declaration) {
            List<Expression> initializers = new ArrayList<>();
            for (VariableDeclarator variable : declaration.variables()) {
                if (variable.initializer() != null) {
                    initializers.add(variable.initializer());
                }
            }
            return initializers;
        }
    }
}
