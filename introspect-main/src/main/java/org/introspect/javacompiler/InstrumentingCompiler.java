package org.introspect.javacompiler;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.ToolProvider;

import org.introspect.InstrumentCompileException;
import org.introspect.IntrospectConfig;
import org.introspect.javaparser.AssertionRewriter;
import org.introspect.javaparser.RewriteResult;
import org.introspect.runtime.Capture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites Java sources, compiles them with the system compiler and loads the result from memory.
 * <pre>
 * InstrumentingCompiler compiler = new InstrumentingCompiler();
 * Class&lt;?&gt; checks = compiler.compile("demo.Checks", source);
 * </pre>
 */
public final class InstrumentingCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(InstrumentingCompiler.class);

    private final AssertionRewriter rewriter;
    private final ClassLoader parent;

    public InstrumentingCompiler() {
        this(IntrospectConfig.defaults());
    }

    public InstrumentingCompiler(IntrospectConfig config) {
        this(config, InstrumentingCompiler.class.getClassLoader());
    }

    public InstrumentingCompiler(IntrospectConfig config, ClassLoader parent) {
        this.rewriter = new AssertionRewriter(config);
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    /**
     * Compiles one class and loads it.
     */
    public Class<?> compile(String className, String source) {
        MemoryClassLoader loader = compile(Map.of(className, source));
        try {
            return loader.loadClass(className);
        } catch (ClassNotFoundException e) {
            throw new InstrumentCompileException("Class " + className + " was not produced by its source", source, "", e);
        }
    }

    /**
     * Rewrites and compiles a set of sources keyed by fully qualified class name.
     *
     * @throws org.introspect.SourceParseException if a source cannot be parsed
     * @throws InstrumentCompileException          if javac rejects the rewritten sources
     */
    public MemoryClassLoader compile(Map<String, String> sources) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new InstrumentCompileException("No system Java compiler; a JDK is required", "", "");
        }

        List<MemorySource> units = new ArrayList<>();
        Map<String, String> rewritten = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : sources.entrySet()) {
            String fileName = entry.getKey().replace('.', '/') + ".java";
            RewriteResult result = rewriter.rewrite(fileName, entry.getValue());
            rewritten.put(entry.getKey(), result.getSource());
            units.add(new MemorySource(entry.getKey(), result.getSource()));
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        List<String> options = List.of("-classpath", classPath(), "-proc:none", "-g");
        Map<String, byte[]> byteCode;
        try (MemoryFileManager fileManager = new MemoryFileManager(compiler.getStandardFileManager(diagnostics, null, null))) {
            boolean success = compiler.getTask(null, fileManager, diagnostics, options, null, units).call();
            if (!success) {
                String report = diagnostics.getDiagnostics().stream()
                        .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                        .map(InstrumentingCompiler::format)
                        .collect(Collectors.joining("\n"));
                String generated = String.join("\n", rewritten.values());
                LOG.error("Compilation of rewritten sources failed:\n{}", report);
                throw new InstrumentCompileException("Compilation of rewritten sources failed", generated, report);
            }
            byteCode = fileManager.getByteCode();
        } catch (IOException e) {
            throw new InstrumentCompileException("Cannot release the compiler file manager",
                                                 String.join("\n", rewritten.values()), e.getMessage(), e);
        }

        LOG.debug("Compiled {} class(es) from {} source(s)", byteCode.size(), sources.size());
        return new MemoryClassLoader(parent, byteCode);
    }

    public AssertionRewriter getRewriter() {
        return rewriter;
    }

    private static String format(Diagnostic<? extends JavaFileObject> diagnostic) {
        String source = diagnostic.getSource() == null ? "<unknown>" : diagnostic.getSource().getName();
        return source + ":" + diagnostic.getLineNumber() + ": " + diagnostic.getMessage(null);
    }

    // surefire may hide the real class path behind a manifest-only jar
    static String classPath() {
        Set<String> entries = new LinkedHashSet<>();
        String current = System.getProperty("java.class.path");
        if (current != null && !current.isEmpty()) {
            entries.add(current);
        }
        addCodeSource(entries, Capture.class);
        addCodeSource(entries, Logger.class);
        return String.join(File.pathSeparator, entries);
    }

    private static void addCodeSource(Set<String> entries, Class<?> anchor) {
        CodeSource codeSource = anchor.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return;
        }
        URL location = codeSource.getLocation();
        try {
            entries.add(Paths.get(location.toURI()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOG.debug("Ignoring code source {} of {}", location, anchor.getName(), e);
        }
    }
}
