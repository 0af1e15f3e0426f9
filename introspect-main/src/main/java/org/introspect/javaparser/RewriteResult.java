package org.introspect.javaparser;

import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import org.introspect.diagnostics.Diagnostic;

/**
 * Outcome of rewriting one compilation unit.
 */
public final class RewriteResult {

    private final String fileName;
    private final CompilationUnit unit;
    private final int rewrittenCount;
    private final int skippedCount;
    private final List<Diagnostic> diagnostics;

    RewriteResult(String fileName, CompilationUnit unit, int rewrittenCount, int skippedCount, List<Diagnostic> diagnostics) {
        this.fileName = fileName;
        this.unit = unit;
        this.rewrittenCount = rewrittenCount;
        this.skippedCount = skippedCount;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getFileName() {
        return fileName;
    }

    public CompilationUnit getUnit() {
        return unit;
    }

    /**
     * @return the rewritten unit printed as Java source
     */
    public String getSource() {
        return unit.toString();
    }

    public int getRewrittenCount() {
        return rewrittenCount;
    }

    /**
     * @return occurrences left untouched because they could not be instrumented
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return "RewriteResult{" +
               "fileName='" + fileName + '\'' +
               ", rewrittenCount=" + rewrittenCount +
               ", skippedCount=" + skippedCount +
               ", diagnostics=" + diagnostics.size() +
               '}';
    }
}
