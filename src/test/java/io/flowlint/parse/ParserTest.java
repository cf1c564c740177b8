package io.flowlint.parse;

import io.flowlint.syntax.Accessor;
import io.flowlint.syntax.BinaryExpression;
import io.flowlint.syntax.ClassDeclaration;
import io.flowlint.syntax.Comment;
import io.flowlint.syntax.ElementAccessExpression;
import io.flowlint.syntax.EventDeclaration;
import io.flowlint.syntax.FieldDeclaration;
import io.flowlint.syntax.GotoStatement;
import io.flowlint.syntax.LabeledStatement;
import io.flowlint.syntax.LambdaExpression;
import io.flowlint.syntax.LocalDeclarationStatement;
import io.flowlint.syntax.MemberDeclaration;
import io.flowlint.syntax.MethodDeclaration;
import io.flowlint.syntax.PropertyDeclaration;
import io.flowlint.syntax.Statement;
import io.flowlint.syntax.StatementKind;
import io.flowlint.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    @Test
    void parse_classMembers() throws ParseException {
        SyntaxTree tree = Parser.parse("""
                using System;
                namespace Demo {
                    public class C {
                        private int a, b;
                        public int P { get; private set; }
                        public event EventHandler Changed;
                        public C(int a) : base(a) { }
                        public abstract void Abstract();
                        void M() { }
                    }
                }
                """);

        assertThat(tree.root().classes()).hasSize(1);
        ClassDeclaration cls = tree.root().classes().get(0);
        List<MemberDeclaration> members = cls.members();

        assertThat(cls.name()).isEqualTo("C");
        assertThat(members).hasSize(6);
        assertThat(((FieldDeclaration) members.get(0)).variables()).hasSize(2);
        assertThat(((PropertyDeclaration) members.get(1)).accessors())
                .extracting(Accessor::kind)
                .containsExactly(Accessor.Kind.GET, Accessor.Kind.SET);
        assertThat(((EventDeclaration) members.get(2)).name()).isEqualTo("Changed");

        MethodDeclaration constructor = (MethodDeclaration) members.get(3);
        assertThat(constructor.typeName()).isNull();
        assertThat(constructor.parameters()).hasSize(1);

        MethodDeclaration abstractMethod = (MethodDeclaration) members.get(4);
        assertThat(abstractMethod.hasBody()).isFalse();
        assertThat(abstractMethod.modifiers()).contains("public", "abstract");

        MethodDeclaration method = (MethodDeclaration) members.get(5);
        assertThat(tree.textOf(method.nameSpan())).isEqualTo("M");
        assertThat(method.typeName()).isEqualTo("void");
    }

    @Test
    void parse_childSpansNestInsideParents() throws ParseException {
        SyntaxTree tree = Parser.parse("""
                class C {
                    int P { get { return this.P; } }
                    void M(int x) {
                        for (var i = 0; i < x; i++) { if (i > 2) break; else continue; }
                        switch (x) { case 1: return; default: throw new Exception(); }
                        try { M(x - 1); } catch (Exception e) { } finally { x++; }
                    }
                }
                """);

        assertThat(tree.root().descendants().toList()).isNotEmpty().allSatisfy(node -> {
            assertThat(node.parent()).isNotNull();
            assertThat(node.parent().span().contains(node.span())).isTrue();
            assertThat(tree.contains(node)).isTrue();
        });
    }

    @Test
    void parse_binaryPrecedence() throws ParseException {
        SyntaxTree tree = Parser.parse("class C { void M() { var x = a + b * c; } }");

        LocalDeclarationStatement declaration = tree.root().descendantsOfType(LocalDeclarationStatement.class).get(0);
        BinaryExpression sum = (BinaryExpression) declaration.variables().get(0).initializer();

        assertThat(sum.operator()).isEqualTo(BinaryExpression.Operator.ADD);
        assertThat(((BinaryExpression) sum.right()).operator()).isEqualTo(BinaryExpression.Operator.MULTIPLY);
        assertThat(tree.textOf(sum)).isEqualTo("a + b * c");
    }

    @Test
    void parse_labelsAndGoto() throws ParseException {
        SyntaxTree tree = Parser.parse("class C { void M() { start: M(); goto start; } }");

        List<Statement> statements = tree.root().descendantsOfType(MethodDeclaration.class).get(0)
                .body().statements();

        assertThat(statements).extracting(Statement::statementKind)
                .containsExactly(StatementKind.LABELED, StatementKind.GOTO);
        LabeledStatement labeled = (LabeledStatement) statements.get(0);
        assertThat(labeled.label()).isEqualTo("start");
        assertThat(labeled.statement().statementKind()).isEqualTo(StatementKind.EXPRESSION);
        assertThat(((GotoStatement) statements.get(1)).label()).isEqualTo("start");
    }

    @Test
    void parse_gotoCaseAndDefault() throws ParseException {
        SyntaxTree tree = Parser.parse(
                "class C { void M(int x) { switch (x) { case 1: goto case 2; case 2: goto default; default: goto end; } end: return; } }");

        List<GotoStatement> jumps = tree.root().descendantsOfType(GotoStatement.class);

        assertThat(jumps).extracting(GotoStatement::target).containsExactly(
                GotoStatement.Target.CASE, GotoStatement.Target.DEFAULT, GotoStatement.Target.LABEL);
        assertThat(tree.textOf(jumps.get(0).caseValue())).isEqualTo("2");
        assertThat(jumps.get(0).label()).isNull();
        assertThat(jumps.get(1).caseValue()).isNull();
        assertThat(jumps.get(2).label()).isEqualTo("end");
        assertThat(jumps.get(0).caseValue().parent()).isSameAs(jumps.get(0));
    }

    @Test
    void parse_elementAccess() throws ParseException {
        SyntaxTree tree = Parser.parse("class C { int[] a; void M() { a[0] = a[1, 2]; } }");

        List<ElementAccessExpression> accesses = tree.root().descendantsOfType(ElementAccessExpression.class);

        assertThat(accesses).hasSize(2);
        assertThat(tree.textOf(accesses.get(0))).isEqualTo("a[0]");
        assertThat(accesses.get(1).indices()).hasSize(2);
    }

    @Test
    void parse_interfaceDeclaration() throws ParseException {
        SyntaxTree tree = Parser.parse("interface IShape { double Area(); int Sides { get; } }");

        ClassDeclaration shape = tree.root().classes().get(0);

        assertThat(shape.name()).isEqualTo("IShape");
        assertThat(shape.members()).hasSize(2);
        assertThat(((MethodDeclaration) shape.members().get(0)).hasBody()).isFalse();
    }

    @Test
    void parse_lambdaForms() throws ParseException {
        SyntaxTree tree = Parser.parse(
                "class C { void M() { Use(x => x + 1); Use((int a, b) => { return a; }); Use(() => M()); } }");

        List<LambdaExpression> lambdas = tree.root().descendantsOfType(LambdaExpression.class);

        assertThat(lambdas).hasSize(3);
        assertThat(lambdas.get(0).hasBlockBody()).isFalse();
        assertThat(lambdas.get(1).hasBlockBody()).isTrue();
        assertThat(lambdas.get(1).parameters()).hasSize(2);
        assertThat(lambdas.get(2).parameters()).isEmpty();
        assertThat(tree.textOf(lambdas.get(1).arrowSpan())).isEqualTo("=>");
    }

    @Test
    void parse_collectsComments() throws ParseException {
        SyntaxTree tree = Parser.parse("""
                // leading
                class C { /* inside */ }
                """);

        assertThat(tree.comments()).extracting(Comment::text).containsExactly("leading", "inside");
        assertThat(tree.textOf(tree.comments().get(1).span())).isEqualTo("/* inside */");
    }

    @Test
    void parse_errorReportsLineAndColumn() {
        String source = "class C {\n  void M() { return }\n}";

        assertThatThrownBy(() -> Parser.parse(source))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.line()).isEqualTo(2);
                    assertThat(e.column()).isEqualTo(21);
                    assertThat(e.getMessage()).startsWith("Unexpected '}'").endsWith("at line 2, column 21");
                });
    }

    @Test
    void parse_rejectsUnterminatedComment() {
        assertThatThrownBy(() -> Parser.parse("class C { } /* open"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unterminated block comment");
    }

    @Test
    void parse_rejectsExpressionBodiedMembers() {
        assertThatThrownBy(() -> Parser.parse("class C { int M() => 1; }"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expression-bodied");
    }

    @Test
    void parse_rejectsTryWithoutHandlers() {
        assertThatThrownBy(() -> Parser.parse("class C { void M() { try { } } }"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected catch or finally");
    }
}
