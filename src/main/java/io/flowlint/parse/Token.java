package io.flowlint.parse;

import io.flowlint.syntax.TextSpan;

/**
 * A lexical token. Keywords are lexed as identifiers and recognized by the parser,
 * since most of them are contextual in the input language.
 *
 * @param kind token category
 * @param text exact source text
 * @param span location in the source
 */
public record Token(TokenKind kind, String text, TextSpan span) {

    public boolean is(String value) {
        return (kind == TokenKind.IDENTIFIER || kind == TokenKind.PUNCTUATOR) && text.equals(value);
    }

    public boolean isIdentifier() {
        return kind == TokenKind.IDENTIFIER;
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }
}
