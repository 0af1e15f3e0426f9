package org.introspect.classify;

import org.introspect.tree.OperatorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperatorTableTest {

    @Test
    void defaultsCoverComparisonsLogicAndBasicArithmetic() {
        OperatorTable table = OperatorTable.defaults();

        assertThat(table.asMap()).hasSize(13);
        assertThat(table.glyph(OperatorKind.REMAINDER)).contains("%");
        assertThat(table.glyph(OperatorKind.AND)).contains("&&");
        assertThat(table.contains(OperatorKind.XOR)).isFalse();
    }

    @Test
    void builderAddsAndRemovesEntries() {
        OperatorTable table = OperatorTable.defaults().toBuilder()
                .with(OperatorKind.XOR, "^")
                .without(OperatorKind.PLUS)
                .build();

        assertThat(table.glyph(OperatorKind.XOR)).contains("^");
        assertThat(table.glyph(OperatorKind.PLUS)).isEmpty();
        assertThat(OperatorTable.defaults().contains(OperatorKind.PLUS)).isTrue();
    }

    @Test
    void glyphsThatWouldBreakTemplatesAreRejected() {
        assertThatThrownBy(() -> OperatorTable.builder().with(OperatorKind.EQUALS, "{}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unsupported character");
        assertThatThrownBy(() -> OperatorTable.builder().with(OperatorKind.EQUALS, "\"=\""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OperatorTable.builder().with(OperatorKind.EQUALS, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Blank glyph");
    }

    @Test
    void tableIsImmutable() {
        OperatorTable table = OperatorTable.defaults();

        assertThatThrownBy(() -> table.asMap().put(OperatorKind.XOR, "^"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
