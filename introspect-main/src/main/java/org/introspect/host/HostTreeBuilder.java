package org.introspect.host;

import java.util.List;

import org.introspect.CaptureFailureException;
import org.introspect.capture.CaptureSlot;
import org.introspect.render.RenderFragment;
import org.introspect.tree.BinaryNode;

/**
 * Capabilities the instrumentation engine needs from the program representation it rewrites.
 * All methods build new host nodes; none of them may modify the nodes they receive.
 *
 * @param <E> the host's expression type
 * @param <S> the host's statement type
 */
public interface HostTreeBuilder<E, S> {

    /**
     * Verifies that the expression can be wrapped for single evaluation without changing its meaning.
     *
     * @throws CaptureFailureException if it cannot
     */
    void checkCapturable(E expression);

    /**
     * Wraps an expression so that evaluating it stores its value in the slot's cell.
     * The wrapped form has the same type, value and truthiness as the original.
     */
    E capture(CaptureSlot slot, E expression);

    /**
     * Rebuilds a binary operator node from already wrapped operands.
     */
    E combine(BinaryNode<E> node, E left, E right);

    /**
     * Reads the cached value of a slot.
     */
    E read(CaptureSlot slot);

    /**
     * Reads the cached value of a boolean slot as a condition.
     */
    E truth(CaptureSlot slot);

    /**
     * Passes a static message fragment and its values to the runtime message accumulator.
     */
    S append(RenderFragment<E> fragment);

    S branch(E condition, S whenTrue, S whenFalse);

    S sequence(List<S> statements);
}
