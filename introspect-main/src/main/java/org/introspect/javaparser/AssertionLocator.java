package org.introspect.javaparser;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import org.introspect.UnsupportedShapeException;

/**
 * Finds assertion occurrences in a compilation unit.
 * <p>
 * Candidates are {@code assert} statements and, optionally, {@code if} statements with a negated
 * condition whose then-branch throws a new {@code AssertionError}. A candidate that does not have
 * the exact layout is rejected by {@link #siteOf(Statement)}.
 */
public final class AssertionLocator {

    private static final String ASSERTION_ERROR = "AssertionError";
    private static final String QUALIFIED_ASSERTION_ERROR = "java.lang.AssertionError";

    private final boolean includeIfThrow;

    public AssertionLocator(boolean includeIfThrow) {
        this.includeIfThrow = includeIfThrow;
    }

    /**
     * @return candidate statements in source order, outer statements before nested ones
     */
    public List<Statement> candidates(CompilationUnit unit) {
        return unit.findAll(Statement.class).stream()
                .filter(this::isCandidate)
                .collect(Collectors.toList());
    }

    private boolean isCandidate(Statement statement) {
        if (statement.isAssertStmt()) {
            return true;
        }
        if (!includeIfThrow || !statement.isIfStmt()) {
            return false;
        }
        IfStmt ifStmt = statement.asIfStmt();
        return isNegation(ifStmt.getCondition()) && findAssertionErrorThrow(ifStmt.getThenStmt()).isPresent();
    }

    /**
     * @throws UnsupportedShapeException if the candidate is not exactly an assertion
     */
    public AssertionSite siteOf(Statement statement) {
        if (statement.isAssertStmt()) {
            AssertStmt assertStmt = statement.asAssertStmt();
            return new AssertionSite(AssertionSite.Kind.ASSERT, statement, assertStmt.getCheck(), assertStmt.getMessage());
        }
        if (!statement.isIfStmt()) {
            throw new UnsupportedShapeException("Not an assertion statement", describe(statement));
        }
        IfStmt ifStmt = statement.asIfStmt();
        if (ifStmt.getElseStmt().isPresent()) {
            throw new UnsupportedShapeException("Assertion check has an else branch", describe(statement));
        }
        Statement then = ifStmt.getThenStmt();
        if (then.isBlockStmt() && then.asBlockStmt().getStatements().size() != 1) {
            throw new UnsupportedShapeException("Assertion check runs other statements before failing", describe(statement));
        }
        ObjectCreationExpr creation = findAssertionErrorThrow(then)
                .orElseThrow(() -> new UnsupportedShapeException("Assertion check does not throw", describe(statement)));
        if (creation.getAnonymousClassBody().isPresent() || creation.getScope().isPresent()) {
            throw new UnsupportedShapeException("AssertionError is subclassed or scoped", describe(statement));
        }
        if (creation.getArguments().size() > 1) {
            throw new UnsupportedShapeException("AssertionError takes more than a detail message", describe(statement));
        }
        Expression condition = unwrap(ifStmt.getCondition()).asUnaryExpr().getExpression();
        Optional<Expression> detail = creation.getArguments().isEmpty()
                ? Optional.empty()
                : Optional.of(creation.getArgument(0));
        return new AssertionSite(AssertionSite.Kind.IF_THROW, statement, condition, detail);
    }

    private static boolean isNegation(Expression condition) {
        Expression unwrapped = unwrap(condition);
        return unwrapped.isUnaryExpr() && unwrapped.asUnaryExpr().getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT;
    }

    private static Optional<ObjectCreationExpr> findAssertionErrorThrow(Statement then) {
        if (then.isBlockStmt()) {
            return then.asBlockStmt().getStatements().stream()
                    .map(AssertionLocator::thrownAssertionError)
                    .flatMap(Optional::stream)
                    .findFirst();
        }
        return thrownAssertionError(then);
    }

    private static Optional<ObjectCreationExpr> thrownAssertionError(Statement statement) {
        if (!statement.isThrowStmt()) {
            return Optional.empty();
        }
        Expression thrown = unwrap(((ThrowStmt) statement).getExpression());
        if (!thrown.isObjectCreationExpr()) {
            return Optional.empty();
        }
        ObjectCreationExpr creation = thrown.asObjectCreationExpr();
        String type = creation.getType().getNameWithScope();
        return ASSERTION_ERROR.equals(type) || QUALIFIED_ASSERTION_ERROR.equals(type)
                ? Optional.of(creation)
                : Optional.empty();
    }

    private static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (current instanceof EnclosedExpr enclosed) {
            current = enclosed.getInner();
        }
        return current;
    }

    private static String describe(Statement statement) {
        String text = statement.toString().replaceAll("\\s+", " ").trim();
        return statement.getBegin().map(position -> "line " + position.line + ": ").orElse("") + text;
    }
}
