package io.flowlint.model;

import java.util.List;

/**
 * A code action attached to an issue.
 *
 * @param title      Human-readable action title, e.g. "Remove 'this.'"
 * @param edits      Text edits against the original source; applied together
 * @param siblingKey Fixes sharing this key can be applied together in one batch
 */
public record Fix(String title, List<TextEdit> edits, String siblingKey) {

    public Fix {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (edits == null || edits.isEmpty()) {
            throw new IllegalArgumentException("a fix needs at least one edit");
        }
        edits = List.copyOf(edits);
        if (siblingKey != null && siblingKey.isBlank()) {
            siblingKey = null;
        }
    }

    public static Fix of(String title, String siblingKey, TextEdit... edits) {
        return new Fix(title, List.of(edits), siblingKey);
    }

    public boolean hasSiblingKey(String key) {
        return siblingKey != null && siblingKey.equals(key);
    }
}
