package io.flowlint;

import io.flowlint.model.Severity;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lint configuration loaded from a YAML file.
 * <pre>
 * disabledRules: [RedundantThisQualifier]
 * severity:
 *   FunctionNeverReturns: ERROR
 * failOn: WARNING
 * threads: 4
 * </pre>
 * Every key is optional. Rule names are matched case-insensitively.
 */
public class LintConfig {

    public static final String DEFAULT_RESOURCE = "/flow-lint.yaml";
    public static final String FILE_NAME = "flow-lint.yaml";

    private static final Severity DEFAULT_FAIL_ON = Severity.WARNING;

    private final Set<String> disabledRules;
    private final Map<String, Severity> severityOverrides;
    private final Severity failOn;
    private final Integer threads;

    private LintConfig(Set<String> disabledRules,
                       Map<String, Severity> severityOverrides,
                       Severity failOn,
                       Integer threads) {
        this.disabledRules = disabledRules;
        this.severityOverrides = severityOverrides;
        this.failOn = failOn;
        this.threads = threads;
    }

    /**
     * Configuration with nothing set.
     */
    public static LintConfig empty() {
        return new LintConfig(Set.of(), Map.of(), null, null);
    }

    /**
     * Loads the configuration bundled on the classpath, or an empty one if none is bundled.
     */
    public static LintConfig loadDefault() throws IOException {
        try (InputStream in = LintConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return empty();
            }
            return parse(in, "classpath:" + DEFAULT_RESOURCE);
        }
    }

    /**
     * Load configuration from a YAML file.
     */
    public static LintConfig load(Path configPath) throws IOException {
        try (InputStream in = Files.newInputStream(configPath)) {
            return parse(in, configPath.toString());
        }
    }

    @SuppressWarnings("unchecked")
    static LintConfig parse(InputStream in, String source) throws IOException {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            return empty();
        }
        if (!(loaded instanceof Map)) {
            throw new IOException("Config " + source + " must be a mapping");
        }
        Map<String, Object> data = (Map<String, Object>) loaded;

        Set<String> disabled = toNameSet(data.get("disabledRules"), source);

        Map<String, Severity> overrides = new LinkedHashMap<>();
        Object severity = data.get("severity");
        if (severity != null) {
            if (!(severity instanceof Map)) {
                throw new IOException("'severity' in " + source + " must map rule names to levels");
            }
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) severity).entrySet()) {
                overrides.put(normalize(String.valueOf(entry.getKey())), severityOf(entry.getValue(), source));
            }
        }

        Severity failOn = data.get("failOn") == null ? null : severityOf(data.get("failOn"), source);

        Integer threads = null;
        Object threadsValue = data.get("threads");
        if (threadsValue != null) {
            if (!(threadsValue instanceof Integer count) || count < 1) {
                throw new IOException("'threads' in " + source + " must be a positive integer");
            }
            threads = count;
        }

        return new LintConfig(Collections.unmodifiableSet(disabled),
                Collections.unmodifiableMap(overrides), failOn, threads);
    }

    private static Set<String> toNameSet(Object value, String source) throws IOException {
        if (value == null) {
            return new LinkedHashSet<>();
        }
        if (!(value instanceof List<?> list)) {
            throw new IOException("'disabledRules' in " + source + " must be a list");
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : list) {
            if (item != null) {
                String trimmed = item.toString().trim();
                if (!trimmed.isEmpty()) {
                    result.add(normalize(trimmed));
                }
            }
        }
        return result;
    }

    private static Severity severityOf(Object value, String source) throws IOException {
        try {
            return Severity.parse(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage() + " (in " + source + ")", e);
        }
    }

    private static String normalize(String ruleName) {
        return ruleName.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns a configuration where values set in {@code other} take precedence.
     * Disabled rules are combined.
     */
    public LintConfig merge(LintConfig other) {
        Set<String> disabled = new LinkedHashSet<>(disabledRules);
        disabled.addAll(other.disabledRules);
        Map<String, Severity> overrides = new LinkedHashMap<>(severityOverrides);
        overrides.putAll(other.severityOverrides);
        return new LintConfig(
                Collections.unmodifiableSet(disabled),
                Collections.unmodifiableMap(overrides),
                other.failOn != null ? other.failOn : failOn,
                other.threads != null ? other.threads : threads);
    }

    public boolean isDisabled(String ruleName) {
        return ruleName != null && disabledRules.contains(normalize(ruleName));
    }

    public Optional<Severity> severityOverride(String ruleName) {
        return Optional.ofNullable(severityOverrides.get(normalize(ruleName)));
    }

    public Set<String> getDisabledRules() {
        return disabledRules;
    }

    public Map<String, Severity> getSeverityOverrides() {
        return severityOverrides;
    }

    public Severity getFailOn() {
        return failOn != null ? failOn : DEFAULT_FAIL_ON;
    }

    public int getThreads() {
        return threads != null ? threads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
