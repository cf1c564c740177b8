package io.flowlint.syntax;

/**
 * Half-open character range {@code [start, end)} into a source text.
 *
 * @param start offset of the first character
 * @param end   offset one past the last character
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static TextSpan between(TextSpan first, TextSpan last) {
        return new TextSpan(first.start(), last.end());
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Returns true if the offset lies inside this span.
     */
    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    /**
     * Returns true if the other span lies entirely inside this one.
     */
    public boolean contains(TextSpan other) {
        return other.start >= start && other.end <= end;
    }

    /**
     * Returns true if both spans share at least one character, or if both are
     * insertions at the same offset.
     */
    public boolean overlaps(TextSpan other) {
        if (isEmpty() && other.isEmpty()) {
            return start == other.start;
        }
        return start < other.end && other.start < end;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + ")";
    }
}
