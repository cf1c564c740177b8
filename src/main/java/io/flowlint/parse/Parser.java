package io.flowlint.parse;

import io.flowlint.syntax.Accessor;
import io.flowlint.syntax.AnonymousMethodExpression;
import io.flowlint.syntax.AssignmentExpression;
import io.flowlint.syntax.BinaryExpression;
import io.flowlint.syntax.BlockStatement;
import io.flowlint.syntax.BreakStatement;
import io.flowlint.syntax.CatchClause;
import io.flowlint.syntax.ClassDeclaration;
import io.flowlint.syntax.CompilationUnit;
import io.flowlint.syntax.ConditionalExpression;
import io.flowlint.syntax.ContinueStatement;
import io.flowlint.syntax.DoWhileStatement;
import io.flowlint.syntax.ElementAccessExpression;
import io.flowlint.syntax.EmptyStatement;
import io.flowlint.syntax.EventDeclaration;
import io.flowlint.syntax.Expression;
import io.flowlint.syntax.ExpressionStatement;
import io.flowlint.syntax.FieldDeclaration;
import io.flowlint.syntax.ForStatement;
import io.flowlint.syntax.ForeachStatement;
import io.flowlint.syntax.GotoStatement;
import io.flowlint.syntax.IdentifierExpression;
import io.flowlint.syntax.IfStatement;
import io.flowlint.syntax.InvocationExpression;
import io.flowlint.syntax.LabeledStatement;
import io.flowlint.syntax.LambdaExpression;
import io.flowlint.syntax.LiteralExpression;
import io.flowlint.syntax.LocalDeclarationStatement;
import io.flowlint.syntax.LockStatement;
import io.flowlint.syntax.MemberAccessExpression;
import io.flowlint.syntax.MemberDeclaration;
import io.flowlint.syntax.MethodDeclaration;
import io.flowlint.syntax.ObjectCreationExpression;
import io.flowlint.syntax.ParameterDeclaration;
import io.flowlint.syntax.ParenthesizedExpression;
import io.flowlint.syntax.PropertyDeclaration;
import io.flowlint.syntax.ReturnStatement;
import io.flowlint.syntax.Statement;
import io.flowlint.syntax.SwitchSection;
import io.flowlint.syntax.SwitchStatement;
import io.flowlint.syntax.SyntaxNode;
import io.flowlint.syntax.SyntaxTree;
import io.flowlint.syntax.TextSpan;
import io.flowlint.syntax.ThisExpression;
import io.flowlint.syntax.ThrowStatement;
import io.flowlint.syntax.TryStatement;
import io.flowlint.syntax.UnaryExpression;
import io.flowlint.syntax.UsingStatement;
import io.flowlint.syntax.VariableDeclarator;
import io.flowlint.syntax.WhileStatement;
import io.flowlint.syntax.YieldBreakStatement;
import io.flowlint.syntax.YieldReturnStatement;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the C#-like subset the rules reason about: top-level
 * classes, structs and interfaces with fields, methods, properties and events, the full
 * statement set including {@code goto case}, and the expression forms listed in
 * {@link io.flowlint.syntax.ExpressionKind}.
 * <p>
 * Not supported: nested types, indexer declarations, generic method calls, casts,
 * {@code is}/{@code as}, {@code ?.}, interpolated strings, array creation and
 * initializers, {@code checked} blocks and expression-bodied members. Files using them
 * fail with a {@link ParseException}.
 */
public class Parser {

    private static final Set<String> RESERVED = Set.of(
            "class", "struct", "namespace", "using", "if", "else", "while", "do", "for", "foreach", "in",
            "switch", "case", "default", "try", "catch", "finally", "lock", "break", "continue", "return",
            "throw", "goto", "this", "base", "new", "true", "false", "null", "delegate", "event",
            "public", "private", "protected", "internal", "static", "readonly", "virtual", "override",
            "abstract", "sealed", "extern", "const", "typeof"
    );

    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "internal", "static", "readonly", "virtual", "override",
            "abstract", "sealed", "extern", "const", "partial", "unsafe", "async", "volatile", "new"
    );

    private final String text;
    private final List<Token> tokens;
    private int pos;

    private Parser(String text, List<Token> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    /**
     * Parses a complete source file.
     */
    public static SyntaxTree parse(String text) throws ParseException {
        Lexer lexer = new Lexer(text);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(text, tokens);
        CompilationUnit root = parser.compilationUnit();
        return new SyntaxTree(text, root, lexer.comments());
    }

    // ---------------------------------------------------------------- declarations

    private CompilationUnit compilationUnit() throws ParseException {
        List<ClassDeclaration> classes = new ArrayList<>();
        while (at("using")) {
            skipUntilAfter(";");
        }
        while (!atEof()) {
            if (at("namespace")) {
                advance();
                qualifiedName();
                if (accept(";") != null) {
                    continue;
                }
                expect("{");
                while (at("using")) {
                    skipUntilAfter(";");
                }
                while (!at("}")) {
                    classes.add(classDeclaration());
                }
                expect("}");
            } else {
                classes.add(classDeclaration());
            }
        }
        return new CompilationUnit(new TextSpan(0, text.length()), classes);
    }

    private ClassDeclaration classDeclaration() throws ParseException {
        Token first = current();
        modifiers();
        if (accept("class") == null && accept("struct") == null && accept("interface") == null) {
            throw error("Expected class, struct or interface declaration");
        }
        Token name = identifier();
        if (accept(":") != null) {
            typeName();
            while (accept(",") != null) {
                typeName();
            }
        }
        expect("{");
        List<MemberDeclaration> members = new ArrayList<>();
        while (!at("}")) {
            members.add(memberDeclaration(name.text()));
        }
        Token close = expect("}");
        return new ClassDeclaration(spanFrom(first, close), name.text(), name.span(), members);
    }

    private MemberDeclaration memberDeclaration(String className) throws ParseException {
        Token first = current();
        Set<String> modifiers = modifiers();

        if (accept("event") != null) {
            String type = typeName();
            Token name = identifier();
            if (at("{")) {
                List<Accessor> accessors = accessorList();
                return new EventDeclaration(spanFrom(first, previous()), modifiers, type, name.text(), name.span(), accessors);
            }
            Token end = expect(";");
            return new EventDeclaration(spanFrom(first, end), modifiers, type, name.text(), name.span(), List.of());
        }

        if (current().is(className) && peek(1).is("(")) {
            Token name = advance();
            return methodRest(first, modifiers, null, name);
        }

        String type = typeName();
        Token name = identifier();
        if (at("(")) {
            return methodRest(first, modifiers, type, name);
        }
        if (at("{")) {
            List<Accessor> accessors = accessorList();
            if (accept("=") != null) {
                expression();
                expect(";");
            }
            return new PropertyDeclaration(spanFrom(first, previous()), modifiers, type, name.text(), name.span(), accessors);
        }

        List<VariableDeclarator> variables = new ArrayList<>();
        variables.add(declaratorRest(name));
        while (accept(",") != null) {
            variables.add(declaratorRest(identifier()));
        }
        Token end = expect(";");
        return new FieldDeclaration(spanFrom(first, end), modifiers, type, variables);
    }

    private MethodDeclaration methodRest(Token first, Set<String> modifiers, String returnType, Token name)
            throws ParseException {
        List<ParameterDeclaration> parameters = parameterList();
        if (returnType == null && accept(":") != null) {
            // constructor initializer, e.g. ": base(x)"
            advance();
            argumentList();
        }
        BlockStatement body = null;
        if (at("=>")) {
            throw error("Expression-bodied members are not supported");
        }
        if (accept(";") == null) {
            body = block();
        }
        return new MethodDeclaration(spanFrom(first, previous()), modifiers, returnType, name.text(), name.span(),
                parameters, body);
    }

    private List<Accessor> accessorList() throws ParseException {
        expect("{");
        List<Accessor> accessors = new ArrayList<>();
        while (!at("}")) {
            Token first = current();
            modifiers();
            Token keyword = advance();
            Accessor.Kind kind = switch (keyword.text()) {
                case "get" -> Accessor.Kind.GET;
                case "set" -> Accessor.Kind.SET;
                case "add" -> Accessor.Kind.ADD;
                case "remove" -> Accessor.Kind.REMOVE;
                default -> throw error("Expected accessor", keyword);
            };
            BlockStatement body = null;
            if (accept(";") == null) {
                body = block();
            }
            accessors.add(new Accessor(spanFrom(first, previous()), kind, keyword.span(), body));
        }
        expect("}");
        return accessors;
    }

    private List<ParameterDeclaration> parameterList() throws ParseException {
        expect("(");
        List<ParameterDeclaration> parameters = new ArrayList<>();
        if (!at(")")) {
            do {
                Token first = current();
                while (at("ref") || at("out") || at("params") || at("this")) {
                    advance();
                }
                String type = typeName();
                Token name = identifier();
                if (accept("=") != null) {
                    expression();
                }
                parameters.add(new ParameterDeclaration(spanFrom(first, previous()), type, name.text()));
            } while (accept(",") != null);
        }
        expect(")");
        return parameters;
    }

    private Set<String> modifiers() {
        Set<String> result = new LinkedHashSet<>();
        while (current().isIdentifier() && MODIFIERS.contains(current().text())) {
            result.add(advance().text());
        }
        return result;
    }

    private String qualifiedName() throws ParseException {
        StringBuilder name = new StringBuilder(identifier().text());
        while (at(".")) {
            advance();
            name.append('.').append(identifier().text());
        }
        return name.toString();
    }

    /**
     * Parses a type reference and returns its source text.
     */
    private String typeName() throws ParseException {
        Token first = current();
        qualifiedName();
        if (at("<")) {
            advance();
            typeName();
            while (accept(",") != null) {
                typeName();
            }
            expect(">");
        }
        while (at("[") && peek(1).is("]")) {
            advance();
            advance();
        }
        accept("?");
        return text.substring(first.start(), previous().end());
    }

    // ---------------------------------------------------------------- statements

    private BlockStatement block() throws ParseException {
        Token open = expect("{");
        List<Statement> statements = new ArrayList<>();
        while (!at("}")) {
            if (atEof()) {
                throw error("Unterminated block");
            }
            statements.add(statement());
        }
        Token close = expect("}");
        return new BlockStatement(spanFrom(open, close), statements);
    }

    private Statement statement() throws ParseException {
        Token first = current();
        if (at("{")) {
            return block();
        }
        if (at(";")) {
            return new EmptyStatement(advance().span());
        }
        if (current().isIdentifier() && peek(1).is(":") && !RESERVED.contains(first.text())) {
            advance();
            advance();
            Statement inner = statement();
            return new LabeledStatement(spanFrom(first, previous()), first.text(), first.span(), inner);
        }
        switch (first.text()) {
            case "if":
                return ifStatement();
            case "while":
                return whileStatement();
            case "do":
                return doWhileStatement();
            case "for":
                return forStatement();
            case "foreach":
                return foreachStatement();
            case "switch":
                return switchStatement();
            case "try":
                return tryStatement();
            case "using":
                return usingStatement();
            case "lock":
                return lockStatement();
            case "break":
                advance();
                return new BreakStatement(spanFrom(first, expect(";")));
            case "continue":
                advance();
                return new ContinueStatement(spanFrom(first, expect(";")));
            case "return": {
                advance();
                Expression value = at(";") ? null : expression();
                return new ReturnStatement(spanFrom(first, expect(";")), value);
            }
            case "throw": {
                advance();
                Expression value = at(";") ? null : expression();
                return new ThrowStatement(spanFrom(first, expect(";")), value);
            }
            case "goto": {
                advance();
                if (accept("default") != null) {
                    return GotoStatement.toDefault(spanFrom(first, expect(";")));
                }
                if (accept("case") != null) {
                    Expression value = expression();
                    return GotoStatement.toCase(spanFrom(first, expect(";")), value);
                }
                Token label = identifier();
                return GotoStatement.toLabel(spanFrom(first, expect(";")), label.text());
            }
            case "yield":
                if (peek(1).is("break")) {
                    advance();
                    advance();
                    return new YieldBreakStatement(spanFrom(first, expect(";")));
                }
                if (peek(1).is("return")) {
                    advance();
                    advance();
                    Expression value = expression();
                    return new YieldReturnStatement(spanFrom(first, expect(";")), value);
                }
                break;
            default:
                break;
        }
        if (looksLikeLocalDeclaration()) {
            DeclarationParts parts = declarationParts();
            Token end = expect(";");
            return new LocalDeclarationStatement(spanFrom(first, end), parts.typeName(), parts.variables());
        }
        Expression expression = expression();
        return new ExpressionStatement(spanFrom(first, expect(";")), expression);
    }

    private IfStatement ifStatement() throws ParseException {
        Token first = expect("if");
        expect("(");
        Expression condition = expression();
        expect(")");
        Statement thenStatement = statement();
        Statement elseStatement = null;
        if (accept("else") != null) {
            elseStatement = statement();
        }
        return new IfStatement(spanFrom(first, previous()), condition, thenStatement, elseStatement);
    }

    private WhileStatement whileStatement() throws ParseException {
        Token first = expect("while");
        expect("(");
        Expression condition = expression();
        expect(")");
        Statement body = statement();
        return new WhileStatement(spanFrom(first, previous()), condition, body);
    }

    private DoWhileStatement doWhileStatement() throws ParseException {
        Token first = expect("do");
        Statement body = statement();
        expect("while");
        expect("(");
        Expression condition = expression();
        expect(")");
        Token end = expect(";");
        return new DoWhileStatement(spanFrom(first, end), body, condition);
    }

    private ForStatement forStatement() throws ParseException {
        Token first = expect("for");
        expect("(");
        LocalDeclarationStatement declaration = null;
        List<Expression> initializers = new ArrayList<>();
        if (!at(";")) {
            if (looksLikeLocalDeclaration()) {
                declaration = localDeclaration();
            } else {
                initializers = expressionList();
            }
        }
        expect(";");
        Expression condition = at(";") ? null : expression();
        expect(";");
        List<Expression> iterators = at(")") ? List.of() : expressionList();
        expect(")");
        Statement body = statement();
        return new ForStatement(spanFrom(first, previous()), declaration, initializers, condition, iterators, body);
    }

    private ForeachStatement foreachStatement() throws ParseException {
        Token first = expect("foreach");
        expect("(");
        String type = typeName();
        Token name = identifier();
        expect("in");
        Expression collection = expression();
        expect(")");
        Statement body = statement();
        VariableDeclarator variable = new VariableDeclarator(name.span(), name.text(), name.span(), null);
        return new ForeachStatement(spanFrom(first, previous()), type, variable, collection, body);
    }

    private SwitchStatement switchStatement() throws ParseException {
        Token first = expect("switch");
        expect("(");
        Expression expression = expression();
        expect(")");
        expect("{");
        List<SwitchSection> sections = new ArrayList<>();
        while (!at("}")) {
            Token sectionStart = current();
            List<Expression> labels = new ArrayList<>();
            boolean hasDefault = false;
            while (at("case") || at("default")) {
                if (accept("default") != null) {
                    hasDefault = true;
                } else {
                    advance();
                    labels.add(expression());
                }
                expect(":");
            }
            if (labels.isEmpty() && !hasDefault) {
                throw error("Expected case or default label");
            }
            List<Statement> statements = new ArrayList<>();
            while (!at("case") && !at("default") && !at("}")) {
                statements.add(statement());
            }
            sections.add(new SwitchSection(spanFrom(sectionStart, previous()), labels, hasDefault, statements));
        }
        Token close = expect("}");
        return new SwitchStatement(spanFrom(first, close), expression, sections);
    }

    private TryStatement tryStatement() throws ParseException {
        Token first = expect("try");
        BlockStatement tryBlock = block();
        List<CatchClause> catches = new ArrayList<>();
        while (at("catch")) {
            Token catchStart = advance();
            String type = null;
            VariableDeclarator variable = null;
            if (accept("(") != null) {
                type = typeName();
                if (current().isIdentifier()) {
                    Token name = advance();
                    variable = new VariableDeclarator(name.span(), name.text(), name.span(), null);
                }
                expect(")");
            }
            BlockStatement body = block();
            catches.add(new CatchClause(spanFrom(catchStart, previous()), type, variable, body));
        }
        BlockStatement finallyBlock = null;
        if (accept("finally") != null) {
            finallyBlock = block();
        }
        if (catches.isEmpty() && finallyBlock == null) {
            throw error("Expected catch or finally");
        }
        return new TryStatement(spanFrom(first, previous()), tryBlock, catches, finallyBlock);
    }

    private UsingStatement usingStatement() throws ParseException {
        Token first = expect("using");
        expect("(");
        LocalDeclarationStatement declaration = null;
        Expression resource = null;
        if (looksLikeLocalDeclaration()) {
            declaration = localDeclaration();
        } else {
            resource = expression();
        }
        expect(")");
        Statement body = statement();
        return new UsingStatement(spanFrom(first, previous()), declaration, resource, body);
    }

    private LockStatement lockStatement() throws ParseException {
        Token first = expect("lock");
        expect("(");
        Expression lockObject = expression();
        expect(")");
        Statement body = statement();
        return new LockStatement(spanFrom(first, previous()), lockObject, body);
    }

    private record DeclarationParts(Token first, String typeName, List<VariableDeclarator> variables) {
    }

    /**
     * Parses {@code Type a = x, b} without the terminating semicolon.
     */
    private DeclarationParts declarationParts() throws ParseException {
        Token first = current();
        String type = typeName();
        List<VariableDeclarator> variables = new ArrayList<>();
        variables.add(declaratorRest(identifier()));
        while (accept(",") != null) {
            variables.add(declaratorRest(identifier()));
        }
        return new DeclarationParts(first, type, variables);
    }

    private LocalDeclarationStatement localDeclaration() throws ParseException {
        DeclarationParts parts = declarationParts();
        return new LocalDeclarationStatement(spanFrom(parts.first(), previous()), parts.typeName(), parts.variables());
    }

    private VariableDeclarator declaratorRest(Token name) throws ParseException {
        Expression initializer = null;
        if (accept("=") != null) {
            initializer = expression();
        }
        return new VariableDeclarator(spanFrom(name, previous()), name.text(), name.span(), initializer);
    }

    private boolean looksLikeLocalDeclaration() {
        int saved = pos;
        try {
            if (!current().isIdentifier() || RESERVED.contains(current().text())) {
                return false;
            }
            typeName();
            return current().isIdentifier() && !RESERVED.contains(current().text())
                    && (peek(1).is("=") || peek(1).is(";") || peek(1).is(",") || peek(1).is(")") || peek(1).is("in"));
        } catch (ParseException e) {
            return false;
        } finally {
            pos = saved;
        }
    }

    // ---------------------------------------------------------------- expressions

    private List<Expression> expressionList() throws ParseException {
        List<Expression> result = new ArrayList<>();
        result.add(expression());
        while (accept(",") != null) {
            result.add(expression());
        }
        return result;
    }

    private Expression expression() throws ParseException {
        if (isLambdaStart()) {
            return lambda();
        }
        Expression left = conditional();
        AssignmentExpression.Operator op = AssignmentExpression.Operator.fromSymbol(current().text());
        if (current().kind() == TokenKind.PUNCTUATOR && op != null) {
            advance();
            Expression right = expression();
            return new AssignmentExpression(TextSpan.between(left.span(), right.span()), left, op, right);
        }
        return left;
    }

    private Expression conditional() throws ParseException {
        Expression condition = binary(1);
        if (accept("?") != null) {
            Expression whenTrue = expression();
            expect(":");
            Expression whenFalse = expression();
            return new ConditionalExpression(TextSpan.between(condition.span(), whenFalse.span()),
                    condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private Expression binary(int minPrecedence) throws ParseException {
        Expression left = unary();
        while (true) {
            BinaryExpression.Operator op = current().kind() == TokenKind.PUNCTUATOR
                    ? BinaryExpression.Operator.fromSymbol(current().text()) : null;
            if (op == null || op.precedence() < minPrecedence) {
                return left;
            }
            advance();
            // "??" is right-associative, everything else left-associative
            int nextMin = op == BinaryExpression.Operator.NULL_COALESCING ? op.precedence() : op.precedence() + 1;
            Expression right = binary(nextMin);
            left = new BinaryExpression(TextSpan.between(left.span(), right.span()), left, op, right);
        }
    }

    private Expression unary() throws ParseException {
        Token first = current();
        UnaryExpression.Operator op = switch (first.kind() == TokenKind.PUNCTUATOR ? first.text() : "") {
            case "!" -> UnaryExpression.Operator.NOT;
            case "-" -> UnaryExpression.Operator.MINUS;
            case "+" -> UnaryExpression.Operator.PLUS;
            case "++" -> UnaryExpression.Operator.INCREMENT;
            case "--" -> UnaryExpression.Operator.DECREMENT;
            default -> null;
        };
        if (op != null) {
            advance();
            Expression operand = unary();
            return new UnaryExpression(new TextSpan(first.start(), operand.end()), op, operand);
        }
        return postfix(primary());
    }

    private Expression postfix(Expression expression) throws ParseException {
        while (true) {
            if (at(".")) {
                advance();
                Token member = identifier();
                expression = new MemberAccessExpression(new TextSpan(expression.start(), member.end()),
                        expression, member.text(), member.span());
            } else if (at("[") && !peek(1).is("]")) {
                advance();
                List<Expression> indices = expressionList();
                Token close = expect("]");
                expression = new ElementAccessExpression(new TextSpan(expression.start(), close.end()),
                        expression, indices);
            } else if (at("(")) {
                List<Expression> arguments = argumentList();
                expression = new InvocationExpression(new TextSpan(expression.start(), previous().end()),
                        expression, arguments);
            } else if (at("++") || at("--")) {
                Token op = advance();
                expression = new UnaryExpression(new TextSpan(expression.start(), op.end()),
                        op.is("++") ? UnaryExpression.Operator.POST_INCREMENT : UnaryExpression.Operator.POST_DECREMENT,
                        expression);
            } else {
                return expression;
            }
        }
    }

    private List<Expression> argumentList() throws ParseException {
        expect("(");
        List<Expression> arguments = new ArrayList<>();
        if (!at(")")) {
            do {
                while (at("ref") || at("out")) {
                    advance();
                }
                arguments.add(expression());
            } while (accept(",") != null);
        }
        expect(")");
        return arguments;
    }

    private Expression primary() throws ParseException {
        Token token = current();
        switch (token.kind()) {
            case NUMBER:
                advance();
                return new LiteralExpression(token.span(), LiteralExpression.Kind.NUMBER, token.text());
            case STRING:
                advance();
                return new LiteralExpression(token.span(), LiteralExpression.Kind.STRING, token.text());
            case CHARACTER:
                advance();
                return new LiteralExpression(token.span(), LiteralExpression.Kind.CHARACTER, token.text());
            case EOF:
                throw error("Unexpected end of input");
            default:
                break;
        }
        if (token.is("(")) {
            advance();
            Expression inner = expression();
            Token close = expect(")");
            return new ParenthesizedExpression(spanFrom(token, close), inner);
        }
        if (!token.isIdentifier()) {
            throw error("Unexpected '" + token.text() + "'");
        }
        switch (token.text()) {
            case "this":
                advance();
                return new ThisExpression(token.span());
            case "true":
            case "false":
                advance();
                return new LiteralExpression(token.span(), LiteralExpression.Kind.BOOLEAN, token.text());
            case "null":
                advance();
                return new LiteralExpression(token.span(), LiteralExpression.Kind.NULL, token.text());
            case "new": {
                advance();
                String type = typeName();
                List<Expression> arguments = argumentList();
                return new ObjectCreationExpression(spanFrom(token, previous()), type, arguments);
            }
            case "delegate": {
                advance();
                List<ParameterDeclaration> parameters = at("(") ? parameterList() : List.of();
                BlockStatement body = block();
                return new AnonymousMethodExpression(spanFrom(token, previous()), token.span(), parameters, body);
            }
            default:
                if (RESERVED.contains(token.text())) {
                    throw error("Unexpected keyword '" + token.text() + "'");
                }
                advance();
                return new IdentifierExpression(token.span(), token.text());
        }
    }

    private boolean isLambdaStart() {
        if (current().isIdentifier() && peek(1).is("=>")) {
            return true;
        }
        if (!at("(")) {
            return false;
        }
        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is("(")) {
                depth++;
            } else if (token.is(")")) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).is("=>");
                }
            } else if (token.kind() == TokenKind.EOF) {
                return false;
            }
        }
        return false;
    }

    private LambdaExpression lambda() throws ParseException {
        Token first = current();
        List<ParameterDeclaration> parameters = new ArrayList<>();
        if (current().isIdentifier()) {
            Token name = advance();
            parameters.add(new ParameterDeclaration(name.span(), null, name.text()));
        } else {
            expect("(");
            if (!at(")")) {
                do {
                    Token paramStart = current();
                    String type = null;
                    if (!(peek(1).is(",") || peek(1).is(")"))) {
                        type = typeName();
                    }
                    Token name = identifier();
                    parameters.add(new ParameterDeclaration(spanFrom(paramStart, name), type, name.text()));
                } while (accept(",") != null);
            }
            expect(")");
        }
        Token arrow = expect("=>");
        SyntaxNode body = at("{") ? block() : expression();
        return new LambdaExpression(new TextSpan(first.start(), body.end()), parameters, arrow.span(), body);
    }

    // ---------------------------------------------------------------- token helpers

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(pos - 1, 0));
    }

    private boolean atEof() {
        return current().kind() == TokenKind.EOF;
    }

    private boolean at(String value) {
        return current().is(value);
    }

    private Token advance() {
        Token token = current();
        if (token.kind() != TokenKind.EOF) {
            pos++;
        }
        return token;
    }

    private Token accept(String value) {
        return at(value) ? advance() : null;
    }

    private Token expect(String value) throws ParseException {
        if (!at(value)) {
            throw error("Expected '" + value + "' but found '" + current().text() + "'");
        }
        return advance();
    }

    private Token identifier() throws ParseException {
        Token token = current();
        if (!token.isIdentifier() || RESERVED.contains(token.text())) {
            throw error("Expected identifier but found '" + token.text() + "'");
        }
        return advance();
    }

    private void skipUntilAfter(String value) throws ParseException {
        while (!at(value)) {
            if (atEof()) {
                throw error("Expected '" + value + "'");
            }
            advance();
        }
        advance();
    }

    private static TextSpan spanFrom(Token first, Token last) {
        return new TextSpan(first.start(), Math.max(first.end(), last.end()));
    }

    private ParseException error(String message) {
        return error(message, current());
    }

    private ParseException error(String message, Token at) {
        return new ParseException(message, text, at.start());
    }
}
