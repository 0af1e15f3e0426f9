package org.introspect.transform;

import java.util.List;
import java.util.Objects;

import org.introspect.capture.CaptureSlot;

/**
 * Result of instrumenting one assertion condition.
 *
 * @param slots       the capture cells the host must declare before the condition runs, in index order
 * @param condition   the wrapped condition; evaluates exactly like the original and fills the cells
 * @param failurePath the code to run in place of the original failure branch; it renders the message
 * @param truncated   whether a static part of the message was cut down to respect the render bounds
 */
public record Instrumentation<E, S>(List<CaptureSlot> slots, E condition, S failurePath, boolean truncated) {

    public Instrumentation {
        slots = List.copyOf(slots);
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(failurePath, "failurePath");
    }
}
