package org.introspect.javaparser;

import java.util.List;
import java.util.Objects;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import org.introspect.CaptureFailureException;
import org.introspect.DiagnosticRoutine;
import org.introspect.IntrospectConfig;
import org.introspect.SourceParseException;
import org.introspect.UnsupportedShapeException;
import org.introspect.capture.CaptureSlot;
import org.introspect.diagnostics.Diagnostic;
import org.introspect.diagnostics.DiagnosticsEngine;
import org.introspect.render.RenderBounds;
import org.introspect.transform.Instrumentation;
import org.introspect.transform.IntrospectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites every assertion of a compilation unit so that a failing check throws an
 * {@link AssertionError} whose message shows the operand values, e.g. {@code (5 % 2) == 0} for
 * {@code assert call(n) % 2 == 0}.
 * <p>
 * Occurrences that cannot be instrumented keep their original code and are reported as warnings.
 * A rewriter is stateless between calls and can be shared.
 */
public final class AssertionRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(AssertionRewriter.class);

    private static final String CAPTURE_TYPE = "org.introspect.runtime.Capture";
    private static final String MESSAGE_TYPE = "org.introspect.runtime.FailureMessage";
    private static final String ERROR_TYPE = "java.lang.AssertionError";
    private static final String THROWABLE_TYPE = "java.lang.Throwable";
    private static final String OBJECT_TYPE = "java.lang.Object";

    private final IntrospectConfig config;
    private final IntrospectionEngine engine;
    private final AssertionLocator locator;
    private final JavaParser parser;

    public AssertionRewriter() {
        this(IntrospectConfig.defaults());
    }

    public AssertionRewriter(IntrospectConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = new IntrospectionEngine(config.getOperatorTable(), config.getRenderBounds());
        this.locator = new AssertionLocator(config.isRewriteIfThrow());
        this.parser = new JavaParser(new ParserConfiguration()
                                             .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    /**
     * @throws SourceParseException if the source is not valid Java
     */
    public RewriteResult rewrite(String fileName, String source) {
        ParseResult<CompilationUnit> parsed;
        synchronized (parser) {
            parsed = parser.parse(source);
        }
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw parseFailure(fileName, parsed.getProblems());
        }
        return rewrite(fileName, parsed.getResult().get());
    }

    /**
     * Rewrites the unit in place.
     */
    public RewriteResult rewrite(String fileName, CompilationUnit unit) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        JavaExpressionReader reader = new JavaExpressionReader();
        int occurrence = 0;
        int rewritten = 0;
        int skipped = 0;

        for (Statement candidate : locator.candidates(unit)) {
            int line = candidate.getBegin().map(position -> position.line).orElse(-1);
            // the enclosing occurrence was replaced, its copy keeps this one unchanged
            if (candidate.findCompilationUnit().isEmpty()) {
                skipped++;
                diagnostics.reportWarning(Diagnostic.Category.NESTED_OCCURRENCE,
                                          "Assertion inside another rewritten assertion is left unchanged", fileName, line);
                LOG.warn("Skipping nested assertion at {}:{}", fileName, line);
                continue;
            }
            try {
                AssertionSite site = locator.siteOf(candidate);
                JavaParserHost host = new JavaParserHost(config.getSlotPrefix(), occurrence++);
                Instrumentation<Expression, Statement> instrumentation = engine.instrument(reader.read(site.condition()), host);
                candidate.replace(buildReplacement(site, host, instrumentation));
                rewritten++;
                if (instrumentation.truncated()) {
                    diagnostics.reportWarning(Diagnostic.Category.RENDER_OVERFLOW,
                                              "Failure message exceeds " + config.getRenderBounds() + " and will be truncated",
                                              fileName, line);
                }
            } catch (UnsupportedShapeException e) {
                skipped++;
                diagnostics.reportWarning(Diagnostic.Category.UNSUPPORTED_SHAPE, e.getMessage(), fileName, line);
                LOG.warn("Skipping assertion at {}:{}: {}", fileName, line, e.getMessage());
            } catch (CaptureFailureException e) {
                skipped++;
                diagnostics.reportWarning(Diagnostic.Category.CAPTURE_FAILURE, e.getMessage(), fileName, line);
                LOG.warn("Skipping assertion at {}:{}: {}", fileName, line, e.getMessage());
            }
        }

        LOG.debug("Rewrote {} assertion(s) in {}, skipped {}", rewritten, fileName, skipped);
        return new RewriteResult(fileName, unit, rewritten, skipped, diagnostics.getDiagnostics());
    }

    public IntrospectConfig getConfig() {
        return config;
    }

    private Statement buildReplacement(AssertionSite site, JavaParserHost host,
                                       Instrumentation<Expression, Statement> instrumentation) {
        BlockStmt checked = new BlockStmt();
        for (CaptureSlot slot : instrumentation.slots()) {
            checked.addStatement(finalLocal(CAPTURE_TYPE, host.slotName(slot), new NodeList<>()));
        }

        BlockStmt failure = new BlockStmt();
        site.detail().ifPresent(detail -> failure.addStatement(finalLocal(
                type(OBJECT_TYPE), host.detailName(), detail.clone())));
        RenderBounds bounds = config.getRenderBounds();
        failure.addStatement(finalLocal(MESSAGE_TYPE, host.messageName(), NodeList.nodeList(
                new IntegerLiteralExpr(String.valueOf(bounds.maxTemplateLength())),
                new IntegerLiteralExpr(String.valueOf(bounds.maxArguments())))));
        Statement failurePath = instrumentation.failurePath();
        if (failurePath.isBlockStmt()) {
            failurePath.asBlockStmt().getStatements().forEach(statement -> failure.addStatement(statement.clone()));
        } else {
            failure.addStatement(failurePath);
        }
        if (site.detail().isEmpty()) {
            failure.addStatement(new ThrowStmt(newError(rendered(host))));
        } else {
            throwWithDetail(failure, site.detail().get(), host);
        }

        checked.addStatement(new IfStmt(new UnaryExpr(instrumentation.condition(), UnaryExpr.Operator.LOGICAL_COMPLEMENT),
                                        failure, null));

        if (site.kind() != AssertionSite.Kind.ASSERT || !config.isHonorAssertionStatus()) {
            return checked;
        }

        // the check only runs where the original assert statement would have
        BlockStmt guarded = new BlockStmt();
        guarded.addStatement(new ExpressionStmt(new VariableDeclarationExpr(
                new VariableDeclarator(PrimitiveType.booleanType(), host.enabledName(), new BooleanLiteralExpr(false)))));
        guarded.addStatement(new AssertStmt(new AssignExpr(new NameExpr(host.enabledName()), new BooleanLiteralExpr(true),
                                                           AssignExpr.Operator.ASSIGN)));
        guarded.addStatement(new IfStmt(new NameExpr(host.enabledName()), checked, null));
        return guarded;
    }

    private Expression rendered(JavaParserHost host) {
        DiagnosticRoutine routine = config.getDiagnosticRoutine();
        NameExpr message = new NameExpr(host.messageName());
        return new MethodCallExpr(StaticJavaParser.parseExpression(routine.ownerClass()),
                                  routine.methodName(),
                                  NodeList.nodeList(new MethodCallExpr(message, "template"),
                                                    new MethodCallExpr(message.clone(), "arguments")));
    }

    // a Throwable detail stays the cause, as it does for new AssertionError(Object)
    private void throwWithDetail(BlockStmt failure, Expression detail, JavaParserHost host) {
        Expression text = new MethodCallExpr(StaticJavaParser.parseExpression("java.lang.String"), "valueOf",
                                             NodeList.nodeList(new NameExpr(host.detailName())));
        Expression message = new BinaryExpr(new BinaryExpr(text, new StringLiteralExpr(": "), BinaryExpr.Operator.PLUS),
                                            rendered(host), BinaryExpr.Operator.PLUS);
        failure.addStatement(finalLocal(type(ERROR_TYPE), host.errorName(), newError(message)));
        failure.addStatement(new IfStmt(
                new InstanceOfExpr(new NameExpr(host.detailName()), type(THROWABLE_TYPE)),
                new ExpressionStmt(new MethodCallExpr(new NameExpr(host.errorName()), "initCause",
                                                      NodeList.nodeList(new CastExpr(type(THROWABLE_TYPE),
                                                                                     new NameExpr(host.detailName()))))),
                null));
        failure.addStatement(new ThrowStmt(new NameExpr(host.errorName())));
    }

    private static Expression newError(Expression message) {
        return new ObjectCreationExpr(null, type(ERROR_TYPE), NodeList.nodeList(message));
    }

    private static Statement finalLocal(ClassOrInterfaceType type, String name, Expression initializer) {
        VariableDeclarator declarator = new VariableDeclarator(type, name, initializer);
        return new ExpressionStmt(new VariableDeclarationExpr(declarator, Modifier.finalModifier()));
    }

    private static Statement finalLocal(String typeName, String name, NodeList<Expression> arguments) {
        return finalLocal(type(typeName), name, new ObjectCreationExpr(null, type(typeName), arguments));
    }

    private static ClassOrInterfaceType type(String qualifiedName) {
        return StaticJavaParser.parseClassOrInterfaceType(qualifiedName);
    }

    private static SourceParseException parseFailure(String fileName, List<Problem> problems) {
        if (problems.isEmpty()) {
            return new SourceParseException("Cannot parse " + fileName, fileName, -1, -1);
        }
        Problem first = problems.get(0);
        int line = -1;
        int column = -1;
        if (first.getLocation().isPresent() && first.getLocation().get().getBegin().getRange().isPresent()) {
            line = first.getLocation().get().getBegin().getRange().get().begin.line;
            column = first.getLocation().get().getBegin().getRange().get().begin.column;
        }
        return new SourceParseException("Cannot parse " + fileName + ": " + first.getMessage(), fileName, line, column);
    }
}
