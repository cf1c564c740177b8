package io.flowlint.rules;

import io.flowlint.LintConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleRegistryTest {

    @TempDir
    Path tempDir;

    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = RuleRegistry.createDefault();
    }

    @Test
    void createDefault_containsBothRules() {
        assertThat(registry.allRules()).extracting(Rule::name)
                .containsExactly("RedundantThisQualifier", "FunctionNeverReturns");
    }

    @Test
    void getByName_matchesAliasIgnoringCase() {
        assertThat(registry.getByName("redundantThis")).get()
                .isInstanceOf(RedundantThisQualifierRule.class);
        assertThat(registry.getByName("FUNCTIONNEVERRETURNS")).get()
                .isInstanceOf(FunctionNeverReturnsRule.class);
        assertThat(registry.getByName("Unknown")).isEmpty();
    }

    @Test
    void enabled_skipsDisabledRules() throws IOException {
        Path config = Files.writeString(tempDir.resolve("flow-lint.yaml"), "disabledRules: [RedundantThis]\n");

        List<Rule> enabled = registry.enabled(LintConfig.load(config));

        assertThat(enabled).extracting(Rule::name).containsExactly("FunctionNeverReturns");
    }

    @Test
    void enabled_allByDefault() {
        assertThat(registry.enabled(LintConfig.empty())).hasSize(2);
    }

    @Test
    void select_keepsRegistryOrderAndDropsDuplicates() {
        List<Rule> selected = registry.select(List.of("FunctionNeverReturns", "RedundantThis", "RedundantThisQualifier"));

        assertThat(selected).extracting(Rule::name)
                .containsExactly("RedundantThisQualifier", "FunctionNeverReturns");
    }

    @Test
    void select_unknownRuleFails() {
        assertThatThrownBy(() -> registry.select(List.of("NoSuchRule")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NoSuchRule");
    }

    @Test
    void of_createsRegistryWithGivenRules() {
        RuleRegistry single = RuleRegistry.of(new FunctionNeverReturnsRule());

        assertThat(single.allRules()).hasSize(1);
        assertThat(single.getByName("RedundantThisQualifier")).isEmpty();
    }
}
