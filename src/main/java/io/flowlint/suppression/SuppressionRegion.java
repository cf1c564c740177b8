package io.flowlint.suppression;

/**
 * A source range in which findings of one rule are discarded.
 *
 * @param ruleName rule named by the disable marker, or {@link SuppressionTracker#ALL}
 * @param start    first suppressed offset (end of the disable comment)
 * @param end      first offset no longer suppressed (start of the restore comment, or end of file)
 */
public record SuppressionRegion(String ruleName, int start, int end) {

    public SuppressionRegion {
        if (ruleName == null || ruleName.isBlank()) {
            throw new IllegalArgumentException("ruleName cannot be null or blank");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid region [" + start + ", " + end + ")");
        }
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean isWildcard() {
        return SuppressionTracker.ALL.equalsIgnoreCase(ruleName);
    }
}
