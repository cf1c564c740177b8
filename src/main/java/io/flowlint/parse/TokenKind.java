package io.flowlint.parse;

public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHARACTER,
    PUNCTUATOR,
    EOF
}
