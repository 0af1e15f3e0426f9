package org.introspect;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;

import javax.lang.model.SourceVersion;

import org.introspect.runtime.Diagnostics;

/**
 * The static method instrumented code calls to turn a failure template and its arguments into the
 * assertion message. Its signature must be {@code static String name(String template, Object[] arguments)}.
 *
 * @param ownerClass canonical name of the declaring class
 * @param methodName simple method name
 */
public record DiagnosticRoutine(String ownerClass, String methodName) {

    public static final DiagnosticRoutine DEFAULT = of(Diagnostics.class, "describe");

    public DiagnosticRoutine {
        if (ownerClass == null || !SourceVersion.isName(ownerClass)) {
            throw new IllegalArgumentException("Invalid routine class name: " + ownerClass);
        }
        if (methodName == null || !SourceVersion.isIdentifier(methodName) || SourceVersion.isKeyword(methodName)) {
            throw new IllegalArgumentException("Invalid routine method name: " + methodName);
        }
    }

    /**
     * Resolves the routine against a loaded class, verifying its signature.
     */
    public static DiagnosticRoutine of(Class<?> owner, String methodName) {
        Objects.requireNonNull(owner, "owner");
        if (owner.getCanonicalName() == null) {
            throw new IllegalArgumentException("Routine class " + owner.getName() + " has no canonical name");
        }
        Method method;
        try {
            method = owner.getMethod(methodName, String.class, Object[].class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No public method " + methodName + "(String, Object[]) on "
                                               + owner.getName(), e);
        }
        if (!Modifier.isStatic(method.getModifiers()) || method.getReturnType() != String.class) {
            throw new IllegalArgumentException("Routine " + owner.getName() + "#" + methodName
                                               + " must be static and return String");
        }
        return new DiagnosticRoutine(owner.getCanonicalName(), methodName);
    }

    /**
     * Parses {@code com.example.Owner#method}. The class does not need to be loadable here, only where the
     * instrumented code is compiled.
     */
    public static DiagnosticRoutine parse(String text) {
        int separator = text == null ? -1 : text.indexOf('#');
        if (separator <= 0 || separator == text.length() - 1) {
            throw new IllegalArgumentException("Expected <class>#<method>, got: " + text);
        }
        return new DiagnosticRoutine(text.substring(0, separator), text.substring(separator + 1));
    }

    public String qualifiedName() {
        return ownerClass + "." + methodName;
    }

    @Override
    public String toString() {
        return ownerClass + "#" + methodName;
    }
}
