package org.introspect.transform;

import java.util.Objects;

import org.introspect.capture.CapturedOperand;
import org.introspect.capture.OperandCaptureWrapper;
import org.introspect.classify.ExpressionClassifier;
import org.introspect.classify.OperatorTable;
import org.introspect.host.HostTreeBuilder;
import org.introspect.render.RenderBounds;
import org.introspect.tree.ExpressionNode;

/**
 * Instruments one assertion condition: capture first, then failure-path generation on the captured tree.
 * The engine holds configuration only and can be shared; each call works on its own state.
 */
public final class IntrospectionEngine {

    private final ExpressionClassifier classifier;
    private final RenderBounds bounds;

    public IntrospectionEngine(OperatorTable table, RenderBounds bounds) {
        this.classifier = new ExpressionClassifier(table);
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    /**
     * @throws org.introspect.CaptureFailureException if an operand cannot be captured; nothing has been
     *                                                spliced into the host at that point
     */
    public <E, S> Instrumentation<E, S> instrument(ExpressionNode<E> condition, HostTreeBuilder<E, S> host) {
        OperandCaptureWrapper<E, S> wrapper = new OperandCaptureWrapper<>(classifier, host);
        CapturedOperand<E> captured = wrapper.capture(condition);

        LogicalStructureTransformer<E, S> transformer = new LogicalStructureTransformer<>(host, bounds);
        S failurePath = transformer.transform(captured);

        return new Instrumentation<>(wrapper.getSlots(), captured.wrapped(), failurePath, transformer.isTruncated());
    }

    public ExpressionClassifier getClassifier() {
        return classifier;
    }

    public RenderBounds getBounds() {
        return bounds;
    }
}
