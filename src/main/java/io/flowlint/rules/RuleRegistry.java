package io.flowlint.rules;

import io.flowlint.LintConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Registry of all available rules.
 */
public class RuleRegistry {

    private final List<Rule> rules;

    private RuleRegistry(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates a registry with all built-in rules.
     */
    public static RuleRegistry createDefault() {
        return new RuleRegistry(List.of(
                new RedundantThisQualifierRule(),
                new FunctionNeverReturnsRule()
        ));
    }

    /**
     * Creates a registry with specific rules.
     */
    public static RuleRegistry of(Rule... rules) {
        return new RuleRegistry(Arrays.asList(rules));
    }

    /**
     * Returns the rules that are enabled by default and not disabled by the configuration.
     */
    public List<Rule> enabled(LintConfig config) {
        return rules.stream()
                .filter(Rule::enabledByDefault)
                .filter(rule -> !config.isDisabled(rule.name())
                        && rule.aliases().stream().noneMatch(config::isDisabled))
                .toList();
    }

    /**
     * Returns the named rules, in registry order.
     *
     * @throws IllegalArgumentException if a name matches no rule
     */
    public List<Rule> select(Collection<String> names) {
        List<Rule> selected = new ArrayList<>();
        for (String name : names) {
            Rule rule = getByName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown rule '" + name + "'"));
            if (!selected.contains(rule)) {
                selected.add(rule);
            }
        }
        return rules.stream().filter(selected::contains).toList();
    }

    /**
     * Returns all registered rules.
     */
    public List<Rule> allRules() {
        return rules;
    }

    /**
     * Returns a rule by name or alias, ignoring case.
     */
    public Optional<Rule> getByName(String name) {
        return rules.stream()
                .filter(rule -> rule.isNamed(name))
                .findFirst();
    }
}
