package org.introspect;

public class InstrumentCompileException extends IntrospectionException {

    private final String generatedSource;
    private final String diagnostics;

    public InstrumentCompileException(String message, String generatedSource, String diagnostics) {
        super(message);
        this.generatedSource = generatedSource;
        this.diagnostics = diagnostics;
    }

    public InstrumentCompileException(String message, String generatedSource, String diagnostics, Throwable cause) {
        super(message, cause);
        this.generatedSource = generatedSource;
        this.diagnostics = diagnostics;
    }

    public String getGeneratedSource() {
        return generatedSource;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
