package io.flowlint.parse;

import io.flowlint.syntax.Comment;
import io.flowlint.syntax.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into tokens and collects comments as trivia.
 */
public class Lexer {

    // Longest first so that greedy matching picks "??=" before "??" before "?".
    private static final List<String> PUNCTUATORS = List.of(
            "??=", "=>", "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=", "??",
            "{", "}", "(", ")", "[", "]", ";", ",", ".", ":", "?", "=", "<", ">", "+", "-", "*", "/", "%",
            "!", "&", "|", "^", "~"
    );

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Comment> comments = new ArrayList<>();
    private int pos;

    public Lexer(String text) {
        this.text = text;
    }

    /**
     * Lexes the whole text. The returned list always ends with an EOF token.
     */
    public List<Token> tokenize() throws ParseException {
        tokens.clear();
        comments.clear();
        pos = 0;

        while (true) {
            skipWhitespaceAndComments();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenKind.EOF, "", new TextSpan(text.length(), text.length())));
                return List.copyOf(tokens);
            }
            tokens.add(nextToken());
        }
    }

    /**
     * Comments found by the last {@link #tokenize()} call, in source order.
     */
    public List<Comment> comments() {
        return List.copyOf(comments);
    }

    private void skipWhitespaceAndComments() throws ParseException {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (text.startsWith("//", pos)) {
                int start = pos;
                int end = text.indexOf('\n', pos);
                if (end < 0) {
                    end = text.length();
                }
                if (end > start && text.charAt(end - 1) == '\r') {
                    end--;
                }
                comments.add(new Comment(new TextSpan(start, end), text.substring(start + 2, end).trim()));
                pos = end;
            } else if (text.startsWith("/*", pos)) {
                int start = pos;
                int close = text.indexOf("*/", pos + 2);
                if (close < 0) {
                    throw new ParseException("Unterminated block comment", text, start);
                }
                comments.add(new Comment(new TextSpan(start, close + 2), text.substring(start + 2, close).trim()));
                pos = close + 2;
            } else {
                return;
            }
        }
    }

    private Token nextToken() throws ParseException {
        int start = pos;
        char c = text.charAt(pos);

        if (c == '@' && pos + 1 < text.length() && text.charAt(pos + 1) == '"') {
            return verbatimString(start);
        }
        if (Character.isLetter(c) || c == '_' || c == '@') {
            pos++;
            while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
                pos++;
            }
            return token(TokenKind.IDENTIFIER, start);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"') {
            return quoted(start, '"', TokenKind.STRING);
        }
        if (c == '\'') {
            return quoted(start, '\'', TokenKind.CHARACTER);
        }
        for (String punctuator : PUNCTUATORS) {
            if (text.startsWith(punctuator, pos)) {
                pos += punctuator.length();
                return token(TokenKind.PUNCTUATOR, start);
            }
        }
        throw new ParseException("Unexpected character '" + c + "'", text, start);
    }

    private Token number(int start) {
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < text.length() && text.charAt(pos) == '.' && Character.isDigit(text.charAt(pos + 1))) {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        while (pos < text.length() && "fFdDmMlLuU".indexOf(text.charAt(pos)) >= 0) {
            pos++;
        }
        return token(TokenKind.NUMBER, start);
    }

    private Token quoted(int start, char quote, TokenKind kind) throws ParseException {
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\') {
                pos += 2;
            } else if (c == quote) {
                pos++;
                return token(kind, start);
            } else if (c == '\n') {
                break;
            } else {
                pos++;
            }
        }
        throw new ParseException("Unterminated literal", text, start);
    }

    private Token verbatimString(int start) throws ParseException {
        pos += 2;
        while (pos < text.length()) {
            if (text.charAt(pos) == '"') {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '"') {
                    pos += 2;
                    continue;
                }
                pos++;
                return token(TokenKind.STRING, start);
            }
            pos++;
        }
        throw new ParseException("Unterminated verbatim string", text, start);
    }

    private Token token(TokenKind kind, int start) {
        return new Token(kind, text.substring(start, pos), new TextSpan(start, pos));
    }
}
