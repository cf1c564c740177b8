package io.flowlint.fix;

import io.flowlint.model.TextEdit;

/**
 * Thrown when edits of a fix, or of a batch of fixes, overlap. Nothing is applied;
 * {@link #originalText()} is the text the edits were meant for, unchanged.
 */
public class EditConflictException extends Exception {

    private final String originalText;
    private final TextEdit first;
    private final TextEdit second;

    public EditConflictException(String originalText, TextEdit first, TextEdit second) {
        super("Conflicting edits [" + first.start() + ", " + first.end() + ") and ["
                + second.start() + ", " + second.end() + ")");
        this.originalText = originalText;
        this.first = first;
        this.second = second;
    }

    public String originalText() {
        return originalText;
    }

    public TextEdit first() {
        return first;
    }

    public TextEdit second() {
        return second;
    }
}
