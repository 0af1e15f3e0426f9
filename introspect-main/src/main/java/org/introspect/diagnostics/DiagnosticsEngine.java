package org.introspect.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one rewrite call.
 * <p>
 * This decouples reporting from the rewriting logic: occurrences that cannot be instrumented are reported
 * here and left untouched instead of aborting the whole unit.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportWarning(Diagnostic.Category category, String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, category, message, fileName, lineNumber));
    }

    /**
     * @return an unmodifiable list of all collected diagnostics, in report order
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getDiagnostics(Diagnostic.Category category) {
        return diagnostics.stream()
                .filter(d -> d.category() == category)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * @return all collected diagnostics as a single, newline separated string
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
