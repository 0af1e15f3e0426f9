package org.introspect.javaparser;

import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

/**
 * One assertion occurrence in a compilation unit.
 *
 * @param kind      which statement form it was written in
 * @param statement the statement that will be replaced
 * @param condition the asserted condition, without the negation of the {@code if} form
 * @param detail    the detail message expression, if any
 */
public record AssertionSite(Kind kind, Statement statement, Expression condition, Optional<Expression> detail) {

    public enum Kind {
        /** {@code assert C;} or {@code assert C : D;} */
        ASSERT,
        /** {@code if (!C) throw new AssertionError(D);} */
        IF_THROW
    }

    public AssertionSite {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(detail, "detail");
    }

    public int line() {
        return statement.getBegin().map(position -> position.line).orElse(-1);
    }
}
