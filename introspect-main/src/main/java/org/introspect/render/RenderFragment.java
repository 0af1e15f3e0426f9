package org.introspect.render;

import java.util.List;
import java.util.Objects;

/**
 * A static piece of a failure message: template text with {@code {}} placeholders and the host
 * expressions that supply their values, in source order.
 *
 * @param template  template text
 * @param arguments one value reference per placeholder
 * @param truncated whether content was dropped to respect the render bounds
 */
public record RenderFragment<E>(String template, List<E> arguments, boolean truncated) {

    public RenderFragment {
        Objects.requireNonNull(template, "template");
        arguments = List.copyOf(arguments);
    }

    public boolean isEmpty() {
        return template.isEmpty() && arguments.isEmpty() && !truncated;
    }
}
