package org.introspect.runtime;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticsTest {

    @Test
    void substitutesValuesInOrder() {
        String message = Diagnostics.describe("({} - {}) == {}", new Object[] {5, 100, 150});

        assertThat(message).isEqualTo("(5 - 100) == 150");
    }

    @Test
    void rendersEveryValueKind() {
        String message = Diagnostics.describe("{} {} {} {} {}",
                                              new Object[] {2.5d, "text", 'c', null, new int[] {1, 2}});

        assertThat(message).isEqualTo("2.5 text c null [1, 2]");
    }

    @Test
    void trailingThrowableStaysAnArgument() {
        IllegalStateException failure = new IllegalStateException("boom");

        String message = Diagnostics.describe("{} == {}", new Object[] {1, failure});

        assertThat(message).isEqualTo("1 == " + failure);
    }

    @Test
    void templateWithoutPlaceholdersIsReturnedAsIs() {
        assertThat(Diagnostics.describe("false", new Object[0])).isEqualTo("false");
    }
}
