package org.introspect.capture;

import java.util.Objects;

import org.introspect.classify.Classification;
import org.introspect.tree.ExpressionNode;

/**
 * A condition node after the capture pass: its classification, the slot caching its value and the
 * host expression that evaluates it once. Leaves have no captured children.
 */
public record CapturedOperand<E>(ExpressionNode<E> node,
                                 Classification classification,
                                 CaptureSlot slot,
                                 CapturedOperand<E> left,
                                 CapturedOperand<E> right,
                                 E wrapped) {

    public CapturedOperand {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(wrapped, "wrapped");
        if (classification.isLeaf() != (left == null && right == null)) {
            throw new IllegalArgumentException("Leaves have no operands, operators need both: " + classification.kind());
        }
    }

    static <E> CapturedOperand<E> leaf(ExpressionNode<E> node, CaptureSlot slot, E wrapped) {
        return new CapturedOperand<>(node, Classification.leaf(), slot, null, null, wrapped);
    }

    static <E> CapturedOperand<E> operator(ExpressionNode<E> node, Classification classification, CaptureSlot slot,
                                           CapturedOperand<E> left, CapturedOperand<E> right, E wrapped) {
        return new CapturedOperand<>(node, classification, slot,
                                     Objects.requireNonNull(left, "left"),
                                     Objects.requireNonNull(right, "right"),
                                     wrapped);
    }

    public boolean isLeaf() {
        return classification.isLeaf();
    }
}
