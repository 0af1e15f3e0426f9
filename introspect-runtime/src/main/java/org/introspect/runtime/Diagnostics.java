package org.introspect.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Default diagnostic routine called by instrumented code when an assertion fails.
 */
public final class Diagnostics {

    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private Diagnostics() {}

    /**
     * Substitutes the positional arguments into the {@code {}} placeholders of the template.
     * Values are rendered with {@link String#valueOf(Object)}, arrays element by element.
     *
     * @param template  the failure template, one placeholder per argument
     * @param arguments the captured operand values in source order
     * @return the rendered failure description
     */
    public static String describe(String template, Object[] arguments) {
        // the explicit null keeps a trailing Throwable argument in the message
        String message = MessageFormatter.arrayFormat(template, arguments, null).getMessage();
        logger.debug("Assertion failed: {}", message);
        return message;
    }
}
