package org.introspect.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates text and value pieces in strict source order and combines them into a single
 * {@link RenderFragment}.
 * <p>
 * A piece that would push the template past {@link RenderBounds#maxTemplateLength()} or the arguments past
 * {@link RenderBounds#maxArguments()} is dropped together with every later piece, and the result is
 * flagged as truncated. Placeholders are never split from their arguments.
 */
public final class MessageRenderer<E> {

    public static final String PLACEHOLDER = "{}";

    private final RenderBounds bounds;

    private final StringBuilder template = new StringBuilder();
    private final List<E> arguments = new ArrayList<>();
    private boolean truncated = false;

    public MessageRenderer(RenderBounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    public MessageRenderer<E> text(String text) {
        if (truncated) {
            return this;
        }
        if (template.length() + text.length() > bounds.maxTemplateLength()) {
            truncated = true;
            return this;
        }
        template.append(text);
        return this;
    }

    public MessageRenderer<E> value(E reference) {
        Objects.requireNonNull(reference, "reference");
        if (truncated) {
            return this;
        }
        if (arguments.size() >= bounds.maxArguments()
                || template.length() + PLACEHOLDER.length() > bounds.maxTemplateLength()) {
            truncated = true;
            return this;
        }
        template.append(PLACEHOLDER);
        arguments.add(reference);
        return this;
    }

    public boolean isEmpty() {
        return template.length() == 0 && arguments.isEmpty() && !truncated;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public RenderFragment<E> build() {
        return new RenderFragment<>(template.toString(), arguments, truncated);
    }
}
