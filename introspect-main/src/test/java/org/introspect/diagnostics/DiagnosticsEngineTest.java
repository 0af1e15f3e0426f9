package org.introspect.diagnostics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticsEngineTest {

    @Test
    void warningsAreCollectedInOrder() {
        DiagnosticsEngine engine = new DiagnosticsEngine();

        engine.reportWarning(Diagnostic.Category.CAPTURE_FAILURE, "lambda operand", "A.java", 3);
        engine.reportWarning(Diagnostic.Category.UNSUPPORTED_SHAPE, "else branch", "A.java", 9);

        assertThat(engine.getDiagnostics()).extracting(Diagnostic::lineNumber).containsExactly(3, 9);
        assertThat(engine.getDiagnostics(Diagnostic.Category.UNSUPPORTED_SHAPE)).hasSize(1);
        assertThat(engine.getDiagnostics(Diagnostic.Category.RENDER_OVERFLOW)).isEmpty();
    }

    @Test
    void summaryListsOneDiagnosticPerLine() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning(Diagnostic.Category.RENDER_OVERFLOW, "too long", "B.java", 12);
        engine.reportWarning(Diagnostic.Category.CAPTURE_FAILURE, "pattern", "B.java", 20);

        assertThat(engine.summary()).isEqualTo(
                "[WARNING] B.java:12: too long (RENDER_OVERFLOW)\n[WARNING] B.java:20: pattern (CAPTURE_FAILURE)");
    }
}
