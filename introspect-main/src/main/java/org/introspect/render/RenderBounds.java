package org.introspect.render;

/**
 * Formatting limits for one failure message.
 *
 * @param maxTemplateLength maximum template length in characters, placeholders included
 * @param maxArguments      maximum number of positional arguments
 */
public record RenderBounds(int maxTemplateLength, int maxArguments) {

    public static final int DEFAULT_MAX_TEMPLATE_LENGTH = 1024;
    public static final int DEFAULT_MAX_ARGUMENTS = 64;

    public RenderBounds {
        if (maxTemplateLength <= 0) {
            throw new IllegalArgumentException("maxTemplateLength must be positive: " + maxTemplateLength);
        }
        if (maxArguments < 0) {
            throw new IllegalArgumentException("maxArguments must not be negative: " + maxArguments);
        }
    }

    public static RenderBounds defaults() {
        return new RenderBounds(DEFAULT_MAX_TEMPLATE_LENGTH, DEFAULT_MAX_ARGUMENTS);
    }
}
