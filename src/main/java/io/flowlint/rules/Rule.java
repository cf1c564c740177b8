package io.flowlint.rules;

import io.flowlint.model.Issue;
import io.flowlint.model.Severity;

import java.util.List;

/**
 * Base interface for all issue rules.
 * Each rule inspects one file's syntax tree for a specific kind of problem.
 */
public interface Rule {

    /**
     * Returns the unique name of this rule. Suppression comments refer to it.
     */
    String name();

    /**
     * Alternative names accepted in suppression comments and on the command line.
     */
    default List<String> aliases() {
        return List.of();
    }

    /**
     * Returns a human-readable description of what this rule finds.
     */
    String description();

    default Severity severity() {
        return Severity.WARNING;
    }

    /**
     * Inspects the file behind the context. Suppression is applied by the caller.
     *
     * @param context per-file analysis context
     * @return issues found, in any order
     */
    List<Issue> inspect(AnalysisContext context);

    /**
     * Returns true if this rule is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }

    /**
     * Returns true if the given name is this rule's name or one of its aliases, ignoring case.
     */
    default boolean isNamed(String candidate) {
        if (candidate == null) {
            return false;
        }
        return name().equalsIgnoreCase(candidate)
                || aliases().stream().anyMatch(alias -> alias.equalsIgnoreCase(candidate));
    }
}
