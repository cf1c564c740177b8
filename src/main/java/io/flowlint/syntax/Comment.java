package io.flowlint.syntax;

/**
 * Comment trivia collected by the lexer.
 *
 * @param span full span including the comment delimiters
 * @param text comment body without {@code //} or {@code /* *}{@code /} delimiters
 */
public record Comment(TextSpan span, String text) {
}
