package org.introspect;

/**
 * A located region looks like an assertion but does not have the expected
 * condition / failure-call layout. Only the offending occurrence is skipped.
 */
public class UnsupportedShapeException extends IntrospectionException {

    private final String nodeDescription;

    public UnsupportedShapeException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }
}
