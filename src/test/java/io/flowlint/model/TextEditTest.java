package io.flowlint.model;

import io.flowlint.syntax.TextSpan;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextEditTest {

    @Test
    void conflictsWith_overlappingRanges() {
        assertThat(TextEdit.delete(0, 5).conflictsWith(TextEdit.delete(4, 8))).isTrue();
        assertThat(TextEdit.delete(4, 8).conflictsWith(TextEdit.delete(0, 5))).isTrue();
        assertThat(TextEdit.delete(0, 8).conflictsWith(TextEdit.replace(new TextSpan(2, 3), "x"))).isTrue();
    }

    @Test
    void conflictsWith_adjacentRangesDoNot() {
        assertThat(TextEdit.delete(0, 4).conflictsWith(TextEdit.delete(4, 8))).isFalse();
        assertThat(TextEdit.insert(4, "x").conflictsWith(TextEdit.delete(4, 8))).isFalse();
        assertThat(TextEdit.delete(0, 4).conflictsWith(TextEdit.insert(4, "x"))).isFalse();
    }

    @Test
    void conflictsWith_insertionsAtSameOffset() {
        assertThat(TextEdit.insert(3, "a").conflictsWith(TextEdit.insert(3, "b"))).isTrue();
        assertThat(TextEdit.insert(3, "a").conflictsWith(TextEdit.insert(4, "b"))).isFalse();
    }

    @Test
    void insertionInsideRangeConflicts() {
        assertThat(TextEdit.insert(3, "a").conflictsWith(TextEdit.delete(0, 5))).isTrue();
    }

    @Test
    void constructor_validatesRange() {
        assertThatThrownBy(() -> new TextEdit(-1, 2, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextEdit(3, 2, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThat(new TextEdit(1, 1, null).replacement()).isEmpty();
        assertThat(TextEdit.insert(1, "x").isInsertion()).isTrue();
    }
}
