package org.introspect.capture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.introspect.classify.Classification;
import org.introspect.classify.ExpressionClassifier;
import org.introspect.host.HostTreeBuilder;
import org.introspect.tree.BinaryNode;
import org.introspect.tree.ExpressionNode;

/**
 * Capture pass: wraps every node of a condition so it is evaluated at most once per check.
 * <p>
 * Leaves are wrapped as opaque units. Operator nodes are rebuilt from their wrapped operands and then
 * wrapped themselves, so the wrapped condition still performs the real truth test while recording
 * every intermediate value. Slots are allocated post-order: operands before their operator, left before
 * right, which keeps leaf slots in source order.
 * <p>
 * One instance serves one occurrence; it is not reusable and not thread-safe.
 */
public final class OperandCaptureWrapper<E, S> {

    private final ExpressionClassifier classifier;
    private final HostTreeBuilder<E, S> host;

    private final List<CaptureSlot> slots = new ArrayList<>();

    public OperandCaptureWrapper(ExpressionClassifier classifier, HostTreeBuilder<E, S> host) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.host = Objects.requireNonNull(host, "host");
    }

    /**
     * @throws org.introspect.CaptureFailureException if the host cannot capture one of the nodes
     */
    public CapturedOperand<E> capture(ExpressionNode<E> node) {
        host.checkCapturable(node.source());

        Classification classification = classifier.classify(node);
        if (classification.isLeaf()) {
            CaptureSlot slot = allocate();
            return CapturedOperand.leaf(node, slot, host.capture(slot, node.source()));
        }

        BinaryNode<E> binary = (BinaryNode<E>) node;
        CapturedOperand<E> left = capture(binary.left());
        CapturedOperand<E> right = capture(binary.right());
        CaptureSlot slot = allocate();
        E combined = host.combine(binary, left.wrapped(), right.wrapped());
        return CapturedOperand.operator(node, classification, slot, left, right, host.capture(slot, combined));
    }

    public List<CaptureSlot> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    private CaptureSlot allocate() {
        CaptureSlot slot = new CaptureSlot(slots.size());
        slots.add(slot);
        return slot;
    }
}
