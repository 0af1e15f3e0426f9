package org.introspect.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the failure description of one assertion check: template fragments in source order
 * with their positional arguments, using {@value #PLACEHOLDER} as the value placeholder.
 * <p>
 * The template never grows beyond {@code maxTemplateLength} characters and the argument list never
 * beyond {@code maxArguments} entries. Content that does not fit is dropped at placeholder granularity,
 * so every placeholder in the template keeps its argument, and the message is flagged as truncated.
 */
public final class FailureMessage {

    public static final String PLACEHOLDER = "{}";
    public static final String TRUNCATION_MARKER = " [truncated]";

    private final int maxTemplateLength;
    private final int maxArguments;

    private final StringBuilder template = new StringBuilder();
    private final List<Object> arguments = new ArrayList<>();
    private boolean truncated = false;

    public FailureMessage(int maxTemplateLength, int maxArguments) {
        if (maxTemplateLength <= 0 || maxArguments < 0) {
            throw new IllegalArgumentException("Invalid bounds: maxTemplateLength=" + maxTemplateLength
                                               + ", maxArguments=" + maxArguments);
        }
        this.maxTemplateLength = maxTemplateLength;
        this.maxArguments = maxArguments;
    }

    /**
     * Appends a template fragment and the values for its placeholders.
     *
     * @throws IllegalArgumentException if the number of placeholders in {@code fragment} differs from the
     *                                  number of values
     */
    public FailureMessage append(String fragment, Object... values) {
        int placeholders = countPlaceholders(fragment);
        if (placeholders != values.length) {
            throw new IllegalArgumentException("Fragment '" + fragment + "' has " + placeholders
                                               + " placeholder(s) but " + values.length + " value(s) were given");
        }
        if (truncated) {
            return this;
        }

        int start = 0;
        int valueIndex = 0;
        while (start < fragment.length()) {
            int next = fragment.indexOf(PLACEHOLDER, start);
            String text = next < 0 ? fragment.substring(start) : fragment.substring(start, next);
            if (!appendText(text)) {
                return this;
            }
            if (next < 0) {
                break;
            }
            if (!appendValue(values[valueIndex++])) {
                return this;
            }
            start = next + PLACEHOLDER.length();
        }
        return this;
    }

    /**
     * Flags the message as truncated; used when the fragment was already cut down when it was generated.
     */
    public FailureMessage markTruncated() {
        truncated = true;
        return this;
    }

    public String template() {
        return truncated ? template + TRUNCATION_MARKER : template.toString();
    }

    public Object[] arguments() {
        return arguments.toArray();
    }

    public boolean isTruncated() {
        return truncated;
    }

    private boolean appendText(String text) {
        if (template.length() + text.length() > maxTemplateLength) {
            truncated = true;
            return false;
        }
        template.append(text);
        return true;
    }

    private boolean appendValue(Object value) {
        if (arguments.size() >= maxArguments || template.length() + PLACEHOLDER.length() > maxTemplateLength) {
            truncated = true;
            return false;
        }
        template.append(PLACEHOLDER);
        arguments.add(value);
        return true;
    }

    static int countPlaceholders(String fragment) {
        int count = 0;
        int index = fragment.indexOf(PLACEHOLDER);
        while (index >= 0) {
            count++;
            index = fragment.indexOf(PLACEHOLDER, index + PLACEHOLDER.length());
        }
        return count;
    }

    @Override
    public String toString() {
        return Diagnostics.describe(template(), arguments());
    }
}
