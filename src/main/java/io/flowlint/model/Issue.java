package io.flowlint.model;

import io.flowlint.syntax.TextSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A single diagnostic reported by a rule.
 *
 * @param ruleName Name of the rule that reported the issue
 * @param severity Severity of the issue
 * @param message  Human-readable message
 * @param span     Source range the issue is anchored at
 * @param line     1-based line of the anchor start
 * @param column   1-based column of the anchor start
 * @param fixes    Code actions offered for the issue, possibly none
 */
public record Issue(
        String ruleName,
        Severity severity,
        String message,
        TextSpan span,
        int line,
        int column,
        List<Fix> fixes
) {
    /**
     * Compact constructor with validation.
     */
    public Issue {
        if (ruleName == null || ruleName.isBlank()) {
            throw new IllegalArgumentException("ruleName cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (span == null) {
            throw new IllegalArgumentException("span cannot be null");
        }
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleName;
        private Severity severity = Severity.WARNING;
        private String message;
        private TextSpan span;
        private int line = -1;
        private int column = -1;
        private List<Fix> fixes = List.of();

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder span(TextSpan span) {
            this.span = span;
            return this;
        }

        /**
         * Sets the anchor and derives line and column from the source text.
         */
        public Builder span(TextSpan span, String text) {
            this.span = span;
            this.line = 1;
            this.column = 1;
            int limit = Math.min(span.start(), text.length());
            for (int i = 0; i < limit; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            return this;
        }

        public Builder fixes(List<Fix> fixes) {
            this.fixes = fixes != null ? List.copyOf(fixes) : List.of();
            return this;
        }

        public Builder fix(Fix fix) {
            List<Fix> extended = new ArrayList<>(fixes);
            extended.add(fix);
            this.fixes = List.copyOf(extended);
            return this;
        }

        public Issue build() {
            return new Issue(ruleName, severity, message, span, line, column, fixes);
        }
    }

    /**
     * Returns the first fix carrying the given sibling key.
     */
    public Optional<Fix> fixWithSiblingKey(String siblingKey) {
        return fixes.stream()
                .filter(fix -> fix.hasSiblingKey(siblingKey))
                .findFirst();
    }

    public boolean hasFixes() {
        return !fixes.isEmpty();
    }

    /**
     * Returns a display-friendly location string.
     */
    public String location() {
        if (line > 0) {
            return line + ":" + column;
        }
        return "@" + span.start();
    }

    public Issue withSeverity(Severity newSeverity) {
        return new Issue(ruleName, newSeverity, message, span, line, column, fixes);
    }
}
