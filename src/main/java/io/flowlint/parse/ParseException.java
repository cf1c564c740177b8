package io.flowlint.parse;

/**
 * Thrown when source text cannot be lexed or parsed.
 */
public class ParseException extends Exception {

    private final int offset;
    private final int line;
    private final int column;

    public ParseException(String message, String text, int offset) {
        super(message + " at line " + lineOf(text, offset) + ", column " + columnOf(text, offset));
        this.offset = offset;
        this.line = lineOf(text, offset);
        this.column = columnOf(text, offset);
    }

    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static int columnOf(String text, int offset) {
        int limit = Math.min(offset, text.length());
        int lineStart = text.lastIndexOf('\n', limit - 1) + 1;
        return limit - lineStart + 1;
    }
}
