package org.introspect.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionNodeTest {

    @Test
    void comparisonRejectsArithmeticOperator() {
        Leaf<String> a = new Leaf<>("a");
        Leaf<String> b = new Leaf<>("b");

        assertThatThrownBy(() -> new Comparison<>(OperatorKind.PLUS, a, b, "a + b"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a comparison operator");
    }

    @Test
    void arithmeticRejectsLogicalOperator() {
        Leaf<String> a = new Leaf<>("a");
        Leaf<String> b = new Leaf<>("b");

        assertThatThrownBy(() -> new Arithmetic<>(OperatorKind.AND, a, b, "a && b"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not an arithmetic operator");
    }

    @Test
    void logicalNodesReportTheirOperator() {
        Leaf<String> a = new Leaf<>("a");
        Leaf<String> b = new Leaf<>("b");

        assertThat(new LogicalAnd<>(a, b, "a && b").operator()).isEqualTo(OperatorKind.AND);
        assertThat(new LogicalOr<>(a, b, "a || b").operator()).isEqualTo(OperatorKind.OR);
    }

    @Test
    void everyNodeKeepsItsSource() {
        Comparison<String> node = new Comparison<>(OperatorKind.LESS, new Leaf<>("x"), new Leaf<>("y"), "x < y");

        assertThat(node.source()).isEqualTo("x < y");
        assertThat(node.left().source()).isEqualTo("x");
        assertThat(node.right().source()).isEqualTo("y");
    }

    @Test
    void operatorsAreGroupedByCategory() {
        assertThat(OperatorKind.GREATER_EQUALS.category()).isEqualTo(OperatorKind.Category.COMPARISON);
        assertThat(OperatorKind.UNSIGNED_RIGHT_SHIFT.category()).isEqualTo(OperatorKind.Category.ARITHMETIC);
        assertThat(OperatorKind.OR.category()).isEqualTo(OperatorKind.Category.LOGICAL);
    }
}
