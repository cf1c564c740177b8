package io.flowlint.fix;

import io.flowlint.model.Fix;
import io.flowlint.model.Issue;
import io.flowlint.model.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Applies fixes to source text.
 * <p>
 * All edits of one application refer to offsets in the same original text. They are
 * validated for pairwise overlap first, then applied in a single pass from the start of
 * the text, so either every edit lands or none does. The syntax tree the fixes were
 * computed from is stale afterwards; callers re-parse before analyzing again.
 */
public final class FixApplier {

    private static final Logger log = LoggerFactory.getLogger(FixApplier.class);

    private static final Comparator<TextEdit> BY_POSITION =
            Comparator.comparingInt(TextEdit::start).thenComparingInt(TextEdit::end);

    private FixApplier() {
    }

    public static String apply(Fix fix, String text) throws EditConflictException {
        return applyEdits(fix.edits(), text);
    }

    /**
     * Applies several fixes as one atomic batch.
     *
     * @throws EditConflictException if any two edits of the batch overlap; the text is left untouched
     */
    public static String applyBatch(Collection<Fix> fixes, String text) throws EditConflictException {
        List<TextEdit> edits = new ArrayList<>();
        for (Fix fix : fixes) {
            edits.addAll(fix.edits());
        }
        log.debug("Applying batch of {} fix(es) with {} edit(s)", fixes.size(), edits.size());
        return applyEdits(edits, text);
    }

    /**
     * Batch-applies the sibling group of a key: from each issue, the first fix carrying
     * the key. Issues without such a fix are skipped.
     */
    public static String applySiblings(Collection<Issue> issues, String siblingKey, String text)
            throws EditConflictException {
        List<Fix> siblings = issues.stream()
                .map(issue -> issue.fixWithSiblingKey(siblingKey))
                .flatMap(Optional::stream)
                .toList();
        return applyBatch(siblings, text);
    }

    /**
     * Sibling keys present on the issues, in order of first appearance.
     */
    public static List<String> siblingKeys(Collection<Issue> issues) {
        return issues.stream()
                .flatMap(issue -> issue.fixes().stream())
                .map(Fix::siblingKey)
                .filter(key -> key != null)
                .distinct()
                .toList();
    }

    private static String applyEdits(List<TextEdit> edits, String text) throws EditConflictException {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(BY_POSITION);
        for (TextEdit edit : sorted) {
            if (edit.end() > text.length()) {
                throw new IllegalArgumentException("Edit [" + edit.start() + ", " + edit.end()
                        + ") exceeds text of length " + text.length());
            }
        }
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                TextEdit first = sorted.get(i);
                TextEdit second = sorted.get(j);
                if (second.start() > first.end()) {
                    break;
                }
                if (first.conflictsWith(second)) {
                    throw new EditConflictException(text, first, second);
                }
            }
        }

        StringBuilder result = new StringBuilder(text.length());
        int cursor = 0;
        for (TextEdit edit : sorted) {
            result.append(text, cursor, edit.start());
            result.append(edit.replacement());
            cursor = edit.end();
        }
        result.append(text, cursor, text.length());
        return result.toString();
    }
}
