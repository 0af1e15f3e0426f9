package org.introspect.diagnostics;

/**
 * A single message reported while rewriting a compilation unit.
 *
 * @param type       the severity
 * @param category   what went wrong
 * @param message    the diagnostic message
 * @param fileName   the name of the file being rewritten
 * @param lineNumber the line of the assertion occurrence, or -1 if unknown
 */
public record Diagnostic(
        Type type,
        Category category,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents rewriting. */
        ERROR,
        /** A warning; the occurrence keeps its original code. */
        WARNING,
        /** An informational message. */
        INFO
    }

    /**
     * The reason an occurrence was reported.
     */
    public enum Category {
        /** The assertion does not have the expected condition / failure-call layout. */
        UNSUPPORTED_SHAPE,
        /** An operand could not be wrapped for single evaluation. */
        CAPTURE_FAILURE,
        /** The failure message exceeds the render bounds and will be truncated. */
        RENDER_OVERFLOW,
        /** The assertion sits inside another assertion that was rewritten and keeps its original code. */
        NESTED_OCCURRENCE
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s (%s)", type, fileName, lineNumber, message, category);
    }
}
