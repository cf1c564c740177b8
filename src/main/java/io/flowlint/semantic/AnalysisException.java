package io.flowlint.semantic;

/**
 * Fatal inconsistency between a syntax tree and the resolver asked about it.
 * Aborts the analysis of the current file only.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
