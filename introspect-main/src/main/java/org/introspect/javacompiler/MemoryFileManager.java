package org.introspect.javacompiler;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;

/**
 * Keeps class output in memory; everything else is read through the standard file manager.
 */
final class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {

    private final Map<String, MemoryClassFile> outputs = new LinkedHashMap<>();

    MemoryFileManager(StandardJavaFileManager fileManager) {
        super(fileManager);
    }

    @Override
    public JavaFileObject getJavaFileForOutput(Location location, String className, JavaFileObject.Kind kind,
                                               FileObject sibling) {
        MemoryClassFile file = new MemoryClassFile(className);
        outputs.put(className, file);
        return file;
    }

    Map<String, byte[]> getByteCode() {
        Map<String, byte[]> byteCode = new LinkedHashMap<>();
        outputs.forEach((name, file) -> byteCode.put(name, file.getBytes()));
        return byteCode;
    }
}
