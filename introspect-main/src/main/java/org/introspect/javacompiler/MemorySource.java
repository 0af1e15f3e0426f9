package org.introspect.javacompiler;

import java.net.URI;

import javax.tools.SimpleJavaFileObject;

/**
 * A compilation unit held as a string.
 */
final class MemorySource extends SimpleJavaFileObject {

    private final String code;

    MemorySource(String className, String code) {
        super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
        this.code = code;
    }

    @Override
    public CharSequence getCharContent(boolean ignoreEncodingErrors) {
        return code;
    }
}
