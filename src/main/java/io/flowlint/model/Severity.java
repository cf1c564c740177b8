package io.flowlint.model;

import java.util.Locale;

/**
 * Severity levels for issues. Informational only; the engine never changes behavior
 * based on severity, but the CLI uses it for its failure threshold.
 */
public enum Severity {
    /**
     * Code that is almost certainly wrong.
     */
    ERROR(1, "ERROR"),

    /**
     * Code that is likely wrong, e.g. a function that can never return.
     */
    WARNING(2, "WARNING"),

    /**
     * Code that works but can be simplified.
     */
    SUGGESTION(3, "SUGGESTION"),

    /**
     * Style notes.
     */
    HINT(4, "HINT");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a severity name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known severity
     */
    public static Severity parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("severity cannot be null or blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity '" + name + "', expected one of ERROR, WARNING, SUGGESTION, HINT", e);
        }
    }
}
