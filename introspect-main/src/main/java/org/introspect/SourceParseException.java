package org.introspect;

public class SourceParseException extends IntrospectionException {

    private final String fileName;
    private final int line;
    private final int column;

    public SourceParseException(String message, String fileName, int line, int column) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
