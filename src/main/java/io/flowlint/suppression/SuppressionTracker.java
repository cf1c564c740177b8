package io.flowlint.suppression;

import io.flowlint.syntax.Comment;
import io.flowlint.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers whether a rule is suppressed at a source position, based on
 * {@code // disable RuleName} ... {@code // restore RuleName} comment markers.
 * <p>
 * The optional {@code ReSharper} prefix is accepted. A second disable before the
 * matching restore has no effect, a restore without an open region is ignored, and an
 * unmatched disable extends to the end of the file. {@code All} suppresses every rule.
 * <p>
 * Built once per file and shared by every rule run on that file.
 */
public class SuppressionTracker {

    private static final Logger log = LoggerFactory.getLogger(SuppressionTracker.class);

    public static final String ALL = "All";

    private static final Pattern MARKER_KEYWORD = Pattern.compile("^(?:ReSharper\\s+)?(disable|restore)\\b(.*)$");
    private static final Pattern RULE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // keyed by lower-cased rule name; values in source order
    private final Map<String, List<SuppressionRegion>> regionsByRule;

    private SuppressionTracker(Map<String, List<SuppressionRegion>> regionsByRule) {
        this.regionsByRule = regionsByRule;
    }

    /**
     * Scans the comment trivia of a tree for markers.
     */
    public static SuppressionTracker scan(SyntaxTree tree) {
        return scan(tree.comments(), tree.text().length());
    }

    /**
     * Scans comments in source order; {@code textLength} closes regions left open.
     */
    public static SuppressionTracker scan(Collection<Comment> comments, int textLength) {
        Map<String, Integer> openRegions = new LinkedHashMap<>();
        Map<String, String> displayNames = new HashMap<>();
        Map<String, List<SuppressionRegion>> regions = new HashMap<>();

        for (Comment comment : comments) {
            Matcher keyword = MARKER_KEYWORD.matcher(comment.text());
            if (!keyword.matches()) {
                continue;
            }
            String ruleName = keyword.group(2).trim();
            if (!RULE_NAME.matcher(ruleName).matches()) {
                log.debug("Ignoring malformed suppression marker '{}' at offset {}", comment.text(), comment.span().start());
                continue;
            }
            String key = ruleName.toLowerCase(Locale.ROOT);

            if ("disable".equals(keyword.group(1))) {
                if (!openRegions.containsKey(key)) {
                    openRegions.put(key, comment.span().end());
                    displayNames.put(key, ruleName);
                }
            } else {
                Integer start = openRegions.remove(key);
                if (start == null) {
                    log.debug("Ignoring restore of '{}' without matching disable at offset {}",
                            ruleName, comment.span().start());
                    continue;
                }
                regions.computeIfAbsent(key, k -> new ArrayList<>())
                        .add(new SuppressionRegion(displayNames.get(key), start, comment.span().start()));
            }
        }

        for (Map.Entry<String, Integer> open : openRegions.entrySet()) {
            regions.computeIfAbsent(open.getKey(), k -> new ArrayList<>())
                    .add(new SuppressionRegion(displayNames.get(open.getKey()), open.getValue(), textLength));
        }

        Map<String, List<SuppressionRegion>> sorted = new HashMap<>();
        regions.forEach((key, list) -> {
            list.sort((a, b) -> Integer.compare(a.start(), b.start()));
            sorted.put(key, List.copyOf(list));
        });
        return new SuppressionTracker(sorted);
    }

    /**
     * A tracker with no regions, for files without comments or callers that opt out.
     */
    public static SuppressionTracker empty() {
        return new SuppressionTracker(Map.of());
    }

    /**
     * Returns the regions naming the rule or the wildcard, ordered by start offset.
     */
    public List<SuppressionRegion> regionsFor(String ruleName) {
        List<SuppressionRegion> result = new ArrayList<>(
                regionsByRule.getOrDefault(ruleName.toLowerCase(Locale.ROOT), List.of()));
        if (!ALL.equalsIgnoreCase(ruleName)) {
            result.addAll(regionsByRule.getOrDefault(ALL.toLowerCase(Locale.ROOT), List.of()));
        }
        result.sort((a, b) -> Integer.compare(a.start(), b.start()));
        return result;
    }

    public boolean isSuppressed(String ruleName, int offset) {
        for (SuppressionRegion region : regionsFor(ruleName)) {
            if (region.contains(offset)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasRegions() {
        return !regionsByRule.isEmpty();
    }
}
