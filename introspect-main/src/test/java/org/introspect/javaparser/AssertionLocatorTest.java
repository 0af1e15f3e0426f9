package org.introspect.javaparser;

import java.util.List;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.Statement;
import org.introspect.UnsupportedShapeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssertionLocatorTest {

    private static final String SOURCE = String.join("\n",
            "class Sample {",
            "    void run(int n, Object o) {",
            "        assert n > 0;",
            "        assert n < 10 : \"too big\";",
            "        if (!(n != 3)) throw new AssertionError();",
            "        if (!ready()) { throw new java.lang.AssertionError(\"not ready\"); }",
            "        if (n == 4) throw new AssertionError();",
            "        if (!ready()) throw new IllegalStateException();",
            "        if (!ready()) throw new AssertionError(); else n++;",
            "        if (!ready()) { n++; throw new AssertionError(); }",
            "        if (!ready()) throw new AssertionError(\"x\", null);",
            "    }",
            "    boolean ready() { return true; }",
            "}");

    private final CompilationUnit unit = StaticJavaParser.parse(SOURCE);

    @Test
    void findsAssertAndNegatedIfThrow() {
        List<Statement> candidates = new AssertionLocator(true).candidates(unit);

        assertThat(candidates).extracting(s -> s.getBegin().get().line).containsExactly(3, 4, 5, 6, 9, 10, 11);
    }

    @Test
    void ifThrowCanBeSwitchedOff() {
        List<Statement> candidates = new AssertionLocator(false).candidates(unit);

        assertThat(candidates).allMatch(Statement::isAssertStmt).hasSize(2);
    }

    @Test
    void assertStatementsBecomeSites() {
        AssertionLocator locator = new AssertionLocator(true);
        List<Statement> candidates = locator.candidates(unit);

        AssertionSite plain = locator.siteOf(candidates.get(0));
        AssertionSite detailed = locator.siteOf(candidates.get(1));

        assertThat(plain.kind()).isEqualTo(AssertionSite.Kind.ASSERT);
        assertThat(plain.condition().toString()).isEqualTo("n > 0");
        assertThat(plain.detail()).isEmpty();
        assertThat(detailed.detail()).map(Object::toString).contains("\"too big\"");
        assertThat(detailed.line()).isEqualTo(4);
    }

    @Test
    void ifThrowSitesDropTheNegation() {
        AssertionLocator locator = new AssertionLocator(true);
        List<Statement> candidates = locator.candidates(unit);

        AssertionSite bare = locator.siteOf(candidates.get(2));
        AssertionSite braced = locator.siteOf(candidates.get(3));

        assertThat(bare.kind()).isEqualTo(AssertionSite.Kind.IF_THROW);
        assertThat(bare.condition().toString()).isEqualTo("(n != 3)");
        assertThat(braced.condition().toString()).isEqualTo("ready()");
        assertThat(braced.detail()).map(Object::toString).contains("\"not ready\"");
    }

    @Test
    void malformedIfThrowIsRejected() {
        AssertionLocator locator = new AssertionLocator(true);
        List<Statement> candidates = locator.candidates(unit);

        assertThatThrownBy(() -> locator.siteOf(candidates.get(4)))
            .isInstanceOf(UnsupportedShapeException.class)
            .hasMessageContaining("else branch");
        assertThatThrownBy(() -> locator.siteOf(candidates.get(5)))
            .isInstanceOf(UnsupportedShapeException.class)
            .hasMessageContaining("other statements");
        assertThatThrownBy(() -> locator.siteOf(candidates.get(6)))
            .isInstanceOf(UnsupportedShapeException.class)
            .hasMessageContaining("more than a detail message")
            .satisfies(e -> assertThat(((UnsupportedShapeException) e).getNodeDescription()).startsWith("line 11: "));
    }
}
