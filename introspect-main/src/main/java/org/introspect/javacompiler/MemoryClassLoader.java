package org.introspect.javacompiler;

import java.util.Map;
import java.util.Set;

/**
 * Defines compiled classes from memory. Assertions are enabled for every class it defines, so the
 * rewritten {@code assert} statements are live.
 */
public final class MemoryClassLoader extends ClassLoader {

    static {
        registerAsParallelCapable();
    }

    private final Map<String, byte[]> byteCode;

    MemoryClassLoader(ClassLoader parent, Map<String, byte[]> byteCode) {
        super(parent);
        this.byteCode = Map.copyOf(byteCode);
        setDefaultAssertionStatus(true);
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
        byte[] bytes = byteCode.get(name);
        if (bytes == null) {
            throw new ClassNotFoundException(name);
        }
        return defineClass(name, bytes, 0, bytes.length);
    }

    /**
     * @return binary names of every class compiled into this loader, nested classes included
     */
    public Set<String> getClassNames() {
        return byteCode.keySet();
    }
}
