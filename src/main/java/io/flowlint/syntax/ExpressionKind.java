package io.flowlint.syntax;

/**
 * Closed set of expression kinds.
 */
public enum ExpressionKind {
    IDENTIFIER,
    THIS,
    LITERAL,
    MEMBER_ACCESS,
    INVOCATION,
    ELEMENT_ACCESS,
    ASSIGNMENT,
    UNARY,
    BINARY,
    CONDITIONAL,
    PARENTHESIZED,
    OBJECT_CREATION,
    LAMBDA,
    ANONYMOUS_METHOD
}
