package io.flowlint.model;

import java.util.List;
import java.util.Optional;

/**
 * Analysis outcome for one file: either its issues, or the error that stopped the analysis.
 *
 * @param file   File path or other identifier as given by the caller
 * @param issues Issues of all rules that ran, ordered by position
 * @param error  Failure detail when the file could not be analyzed, otherwise null
 */
public record FileReport(String file, List<Issue> issues, String error) {

    public FileReport {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("file cannot be null or blank");
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        if (error != null && !issues.isEmpty()) {
            throw new IllegalArgumentException("a failed file cannot carry issues");
        }
    }

    public static FileReport success(String file, List<Issue> issues) {
        return new FileReport(file, issues, null);
    }

    public static FileReport failure(String file, String error) {
        return new FileReport(file, List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
