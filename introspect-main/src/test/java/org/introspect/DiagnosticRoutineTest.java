package org.introspect;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticRoutineTest {

    public static String shout(String template, Object[] arguments) {
        return template.toUpperCase();
    }

    public String notStatic(String template, Object[] arguments) {
        return template;
    }

    public static int wrongReturn(String template, Object[] arguments) {
        return 0;
    }

    @Test
    void defaultRoutineIsTheRuntimeFormatter() {
        assertThat(DiagnosticRoutine.DEFAULT.qualifiedName()).isEqualTo("org.introspect.runtime.Diagnostics.describe");
    }

    @Test
    void ofVerifiesTheSignature() {
        DiagnosticRoutine routine = DiagnosticRoutine.of(DiagnosticRoutineTest.class, "shout");

        assertThat(routine.ownerClass()).isEqualTo("org.introspect.DiagnosticRoutineTest");
        assertThat(routine).hasToString("org.introspect.DiagnosticRoutineTest#shout");

        assertThatThrownBy(() -> DiagnosticRoutine.of(DiagnosticRoutineTest.class, "notStatic"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be static");
        assertThatThrownBy(() -> DiagnosticRoutine.of(DiagnosticRoutineTest.class, "wrongReturn"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DiagnosticRoutine.of(DiagnosticRoutineTest.class, "missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No public method");
    }

    @Test
    void parseSplitsClassAndMethod() {
        DiagnosticRoutine routine = DiagnosticRoutine.parse("com.example.Messages#render");

        assertThat(routine.ownerClass()).isEqualTo("com.example.Messages");
        assertThat(routine.methodName()).isEqualTo("render");
    }

    @Test
    void parseRejectsMalformedText() {
        assertThatThrownBy(() -> DiagnosticRoutine.parse("com.example.Messages")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DiagnosticRoutine.parse("#render")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DiagnosticRoutine.parse("com.example.Messages#")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DiagnosticRoutine.parse("com..Messages#render")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DiagnosticRoutine.parse("com.example.Messages#new")).isInstanceOf(IllegalArgumentException.class);
    }
}
