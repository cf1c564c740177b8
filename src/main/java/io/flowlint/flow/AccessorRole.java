package io.flowlint.flow;

import io.flowlint.syntax.Accessor;

/**
 * Role of the body being analyzed, used to decide which self-references re-enter it.
 */
public enum AccessorRole {
    NONE,
    GETTER,
    SETTER,
    ADD,
    REMOVE;

    public static AccessorRole of(Accessor.Kind kind) {
        return switch (kind) {
            case GET -> GETTER;
            case SET -> SETTER;
            case ADD -> ADD;
            case REMOVE -> REMOVE;
        };
    }
}
