package org.introspect.capture;

import org.introspect.CaptureFailureException;
import org.introspect.classify.Classification;
import org.introspect.classify.ExpressionClassifier;
import org.introspect.classify.OperatorTable;
import org.introspect.host.ClosureHost;
import org.introspect.host.ClosureHost.Step;
import org.introspect.host.ClosureHost.Term;
import org.introspect.tree.ExpressionNode;
import org.introspect.tree.OperatorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.introspect.host.ClosureHost.and;
import static org.introspect.host.ClosureHost.arithmetic;
import static org.introspect.host.ClosureHost.comparison;
import static org.introspect.host.ClosureHost.constant;

class OperandCaptureWrapperTest {

    private final ExpressionClassifier classifier = new ExpressionClassifier(OperatorTable.defaults());

    @Test
    void capturedTreeMirrorsTheCondition() {
        ExpressionNode<Term> condition = and(
                comparison(OperatorKind.LESS, constant(1), constant(2)),
                comparison(OperatorKind.EQUALS, arithmetic(OperatorKind.MINUS, constant(3), constant(1)), constant(2)));
        OperandCaptureWrapper<Term, Step> wrapper = new OperandCaptureWrapper<>(classifier, new ClosureHost());

        CapturedOperand<Term> root = wrapper.capture(condition);

        assertThat(root.node()).isSameAs(condition);
        assertThat(root.classification().kind()).isEqualTo(Classification.Kind.LOGICAL_AND);
        assertThat(root.left().classification().glyph()).isEqualTo("<");
        assertThat(root.right().left().classification().glyph()).isEqualTo("-");
        assertThat(root.right().left().left().isLeaf()).isTrue();
        assertThat(root.right().right().isLeaf()).isTrue();
    }

    @Test
    void leafSlotsAreInSourceOrder() {
        ExpressionNode<Term> condition = comparison(OperatorKind.EQUALS,
                                                    arithmetic(OperatorKind.MINUS, constant(3), constant(1)),
                                                    constant(2));
        OperandCaptureWrapper<Term, Step> wrapper = new OperandCaptureWrapper<>(classifier, new ClosureHost());

        CapturedOperand<Term> root = wrapper.capture(condition);

        assertThat(root.left().left().slot().index()).isEqualTo(0);
        assertThat(root.left().right().slot().index()).isEqualTo(1);
        assertThat(root.left().slot().index()).isEqualTo(2);
        assertThat(root.right().slot().index()).isEqualTo(3);
        assertThat(root.slot().index()).isEqualTo(4);
        assertThat(wrapper.getSlots()).hasSize(5);
    }

    @Test
    void unclassifiedOperatorIsCapturedWhole() {
        ExpressionNode<Term> condition = comparison(OperatorKind.EQUALS,
                                                    arithmetic(OperatorKind.XOR, constant(3), constant(1)),
                                                    constant(2));
        OperandCaptureWrapper<Term, Step> wrapper = new OperandCaptureWrapper<>(classifier, new ClosureHost());

        CapturedOperand<Term> root = wrapper.capture(condition);

        assertThat(root.left().isLeaf()).isTrue();
        assertThat(wrapper.getSlots()).hasSize(3);
    }

    @Test
    void hostRefusalIsPropagated() {
        ExpressionNode<Term> condition = comparison(OperatorKind.EQUALS, ClosureHost.uncapturable(), constant(2));
        OperandCaptureWrapper<Term, Step> wrapper = new OperandCaptureWrapper<>(classifier, new ClosureHost());

        assertThatThrownBy(() -> wrapper.capture(condition))
            .isInstanceOf(CaptureFailureException.class)
            .hasMessageContaining("cannot be captured");
    }
}
