package org.introspect.javaparser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.visitor.GenericVisitorWithDefaults;
import org.introspect.tree.Arithmetic;
import org.introspect.tree.Comparison;
import org.introspect.tree.ExpressionNode;
import org.introspect.tree.Leaf;
import org.introspect.tree.LogicalAnd;
import org.introspect.tree.LogicalOr;
import org.introspect.tree.OperatorKind;

/**
 * Reads a JavaParser condition into the engine's expression tree.
 * <p>
 * Parentheses are transparent. Binary operators become operator nodes, every other expression is a leaf.
 * A binary subtree that javac folds into a compile-time constant is kept as one leaf, so its value stays
 * the folded (and, for a {@code String}, interned) one. A {@code +} over names this unit cannot resolve
 * may be such a constant and is kept whole as well.
 */
public final class JavaExpressionReader extends GenericVisitorWithDefaults<ExpressionNode<Expression>, Void> {

    public ExpressionNode<Expression> read(Expression condition) {
        return condition.accept(this, null);
    }

    @Override
    public ExpressionNode<Expression> visit(EnclosedExpr n, Void arg) {
        return n.getInner().accept(this, arg);
    }

    @Override
    public ExpressionNode<Expression> visit(BinaryExpr n, Void arg) {
        ConstantExpressions.Constancy constancy = ConstantExpressions.classify(n);
        if (constancy == ConstantExpressions.Constancy.CONSTANT
            || (constancy == ConstantExpressions.Constancy.UNKNOWN && n.getOperator() == BinaryExpr.Operator.PLUS)) {
            return new Leaf<>(n);
        }
        ExpressionNode<Expression> left = n.getLeft().accept(this, arg);
        ExpressionNode<Expression> right = n.getRight().accept(this, arg);
        OperatorKind kind = OperatorMapping.toKind(n.getOperator());
        return switch (kind.category()) {
            case COMPARISON -> new Comparison<>(kind, left, right, n);
            case ARITHMETIC -> new Arithmetic<>(kind, left, right, n);
            case LOGICAL -> kind == OperatorKind.AND ? new LogicalAnd<>(left, right, n) : new LogicalOr<>(left, right, n);
        };
    }

    @Override
    public ExpressionNode<Expression> defaultAction(Node n, Void arg) {
        return new Leaf<>((Expression) n);
    }
}
