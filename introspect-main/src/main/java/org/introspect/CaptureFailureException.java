package org.introspect;

/**
 * An operand of an assertion condition cannot be wrapped for single evaluation.
 * Only the offending occurrence is skipped.
 */
public class CaptureFailureException extends IntrospectionException {

    private final String expression;

    public CaptureFailureException(String message, String expression) {
        super(message + ": " + expression);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
