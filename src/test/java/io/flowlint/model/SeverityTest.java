package io.flowlint.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityTest {

    @Test
    void isAtLeast_ordersFromErrorToHint() {
        assertThat(Severity.ERROR.isAtLeast(Severity.WARNING)).isTrue();
        assertThat(Severity.WARNING.isAtLeast(Severity.WARNING)).isTrue();
        assertThat(Severity.SUGGESTION.isAtLeast(Severity.WARNING)).isFalse();
        assertThat(Severity.HINT.isAtLeast(Severity.HINT)).isTrue();
    }

    @Test
    void parse_isCaseInsensitive() {
        assertThat(Severity.parse("warning")).isEqualTo(Severity.WARNING);
        assertThat(Severity.parse(" Hint ")).isEqualTo(Severity.HINT);
    }

    @Test
    void parse_rejectsUnknownNames() {
        assertThatThrownBy(() -> Severity.parse("fatal"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'fatal'")
                .hasMessageContaining("SUGGESTION");
        assertThatThrownBy(() -> Severity.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
