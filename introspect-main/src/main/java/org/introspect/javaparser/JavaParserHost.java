package org.introspect.javaparser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.introspect.CaptureFailureException;
import org.introspect.capture.CaptureSlot;
import org.introspect.host.HostTreeBuilder;
import org.introspect.render.RenderFragment;
import org.introspect.tree.BinaryNode;

/**
 * Builds JavaParser nodes for one assertion occurrence. Capture cells are locals named
 * {@code <prefix><occurrence>_<index>}, the message accumulator {@code <prefix><occurrence>_message}.
 * The other locals of the occurrence share the {@code <prefix><occurrence>_} stem.
 * <p>
 * Original nodes are cloned before they are placed in generated code, so the parsed unit is only changed
 * when the finished replacement is spliced in.
 */
public final class JavaParserHost implements HostTreeBuilder<Expression, Statement> {

    private final String prefix;
    private final int occurrence;

    public JavaParserHost(String slotPrefix, int occurrence) {
        this.prefix = Objects.requireNonNull(slotPrefix, "slotPrefix");
        this.occurrence = occurrence;
    }

    public String slotName(CaptureSlot slot) {
        return prefix + occurrence + "_" + slot.index();
    }

    public String messageName() {
        return prefix + occurrence + "_message";
    }

    public String enabledName() {
        return prefix + occurrence + "_enabled";
    }

    public String detailName() {
        return prefix + occurrence + "_detail";
    }

    public String errorName() {
        return prefix + occurrence + "_error";
    }

    @Override
    public void checkCapturable(Expression expression) {
        // a binding introduced by a pattern does not survive being passed through record(...)
        if (expression.findFirst(PatternExpr.class).isPresent()) {
            throw new CaptureFailureException("Pattern matching cannot be captured", expression.toString());
        }
        checkStandalone(expression, expression);
        // record(...) hides the "assigned when true/false" outcome of && and || from definite assignment
        if (expression.findFirst(AssignExpr.class, assign -> assignsVariable(assign, expression)).isPresent()) {
            throw new CaptureFailureException("Assignment to a variable cannot be captured", expression.toString());
        }
    }

    private static boolean assignsVariable(AssignExpr assign, Expression operand) {
        if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
            return false;
        }
        Expression target = assign.getTarget();
        boolean variable = target.isNameExpr()
                           || (target.isFieldAccessExpr() && target.asFieldAccessExpr().getScope().isThisExpr());
        return variable && !inNestedBody(assign, operand);
    }

    // lambdas and anonymous classes have their own definite assignment scope
    private static boolean inNestedBody(Node node, Expression operand) {
        Node current = node;
        while (current != operand) {
            if (current instanceof LambdaExpr
                || (current instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent())) {
                return true;
            }
            Optional<Node> parent = current.getParentNode();
            if (parent.isEmpty()) {
                return false;
            }
            current = parent.get();
        }
        return false;
    }

    @Override
    public Expression capture(CaptureSlot slot, Expression expression) {
        Expression operand = expression.getParentNode().isPresent() ? expression.clone() : expression;
        return new MethodCallExpr(new NameExpr(slotName(slot)), "record", NodeList.nodeList(operand));
    }

    @Override
    public Expression combine(BinaryNode<Expression> node, Expression left, Expression right) {
        return new BinaryExpr(left, right, OperatorMapping.toOperator(node.operator()));
    }

    @Override
    public Expression read(CaptureSlot slot) {
        return new MethodCallExpr(new NameExpr(slotName(slot)), "get");
    }

    @Override
    public Expression truth(CaptureSlot slot) {
        return new MethodCallExpr(new NameExpr(slotName(slot)), "truth");
    }

    @Override
    public Statement append(RenderFragment<Expression> fragment) {
        Expression call = new NameExpr(messageName());
        if (!fragment.template().isEmpty() || !fragment.arguments().isEmpty()) {
            NodeList<Expression> arguments = new NodeList<>();
            arguments.add(new StringLiteralExpr().setString(fragment.template()));
            for (Expression argument : fragment.arguments()) {
                arguments.add(argument);
            }
            call = new MethodCallExpr(call, "append", arguments);
        }
        if (fragment.truncated()) {
            call = new MethodCallExpr(call, "markTruncated");
        }
        return new ExpressionStmt(call);
    }

    @Override
    public Statement branch(Expression condition, Statement whenTrue, Statement whenFalse) {
        boolean trueEmpty = isEmpty(whenTrue);
        boolean falseEmpty = isEmpty(whenFalse);
        if (trueEmpty && falseEmpty) {
            return new EmptyStmt();
        }
        if (trueEmpty) {
            return new IfStmt(new UnaryExpr(condition, UnaryExpr.Operator.LOGICAL_COMPLEMENT), whenFalse, null);
        }
        return new IfStmt(condition, whenTrue, falseEmpty ? null : whenFalse);
    }

    @Override
    public Statement sequence(List<Statement> statements) {
        BlockStmt block = new BlockStmt();
        for (Statement statement : statements) {
            if (statement.isBlockStmt()) {
                // copied first: adding re-parents the nodes
                List<Statement> nested = new ArrayList<>(statement.asBlockStmt().getStatements());
                nested.forEach(block::addStatement);
            } else if (!statement.isEmptyStmt()) {
                block.addStatement(statement);
            }
        }
        return block;
    }

    static boolean isEmpty(Statement statement) {
        return statement.isEmptyStmt() || (statement.isBlockStmt() && statement.asBlockStmt().getStatements().isEmpty());
    }
}
