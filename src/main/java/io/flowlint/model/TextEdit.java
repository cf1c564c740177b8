package io.flowlint.model;

import io.flowlint.syntax.TextSpan;

/**
 * Replacement of the source range {@code [start, end)} by {@code replacement}.
 * A zero-width edit is an insertion; an empty replacement is a deletion.
 */
public record TextEdit(int start, int end, String replacement) {

    public TextEdit {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ")");
        }
        if (replacement == null) {
            replacement = "";
        }
    }

    public static TextEdit delete(int start, int end) {
        return new TextEdit(start, end, "");
    }

    public static TextEdit replace(TextSpan span, String replacement) {
        return new TextEdit(span.start(), span.end(), replacement);
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(offset, offset, text);
    }

    public boolean isInsertion() {
        return start == end;
    }

    /**
     * Two edits conflict when their ranges overlap, or when both insert at the same offset
     * so that their order would be ambiguous.
     */
    public boolean conflictsWith(TextEdit other) {
        if (start == other.start && end == other.end) {
            return true;
        }
        return start < other.end && other.start < end;
    }
}
