package io.flowlint.semantic;

public enum SymbolKind {
    METHOD,
    FIELD,
    PROPERTY,
    EVENT,
    LOCAL,
    PARAMETER
}
