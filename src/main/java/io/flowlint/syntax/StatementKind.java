package io.flowlint.syntax;

/**
 * Closed set of statement kinds. Consumers switch over it exhaustively, so a new kind
 * fails compilation wherever it is not handled.
 */
public enum StatementKind {
    BLOCK,
    EXPRESSION,
    LOCAL_DECLARATION,
    EMPTY,
    IF,
    WHILE,
    DO_WHILE,
    FOR,
    FOREACH,
    SWITCH,
    TRY,
    USING,
    LOCK,
    BREAK,
    CONTINUE,
    RETURN,
    THROW,
    YIELD_BREAK,
    YIELD_RETURN,
    LABELED,
    GOTO
}
