package org.introspect.javaparser;

import java.util.EnumMap;
import java.util.Map;

import com.github.javaparser.ast.expr.BinaryExpr;
import org.introspect.tree.OperatorKind;

/**
 * Two-way mapping between JavaParser's binary operators and the engine's operator kinds.
 */
public final class OperatorMapping {

    private static final Map<BinaryExpr.Operator, OperatorKind> KINDS = new EnumMap<>(BinaryExpr.Operator.class);
    private static final Map<OperatorKind, BinaryExpr.Operator> OPERATORS = new EnumMap<>(OperatorKind.class);

    static {
        put(BinaryExpr.Operator.EQUALS, OperatorKind.EQUALS);
        put(BinaryExpr.Operator.NOT_EQUALS, OperatorKind.NOT_EQUALS);
        put(BinaryExpr.Operator.LESS, OperatorKind.LESS);
        put(BinaryExpr.Operator.GREATER, OperatorKind.GREATER);
        put(BinaryExpr.Operator.LESS_EQUALS, OperatorKind.LESS_EQUALS);
        put(BinaryExpr.Operator.GREATER_EQUALS, OperatorKind.GREATER_EQUALS);
        put(BinaryExpr.Operator.AND, OperatorKind.AND);
        put(BinaryExpr.Operator.OR, OperatorKind.OR);
        put(BinaryExpr.Operator.PLUS, OperatorKind.PLUS);
        put(BinaryExpr.Operator.MINUS, OperatorKind.MINUS);
        put(BinaryExpr.Operator.MULTIPLY, OperatorKind.MULTIPLY);
        put(BinaryExpr.Operator.DIVIDE, OperatorKind.DIVIDE);
        put(BinaryExpr.Operator.REMAINDER, OperatorKind.REMAINDER);
        put(BinaryExpr.Operator.BINARY_AND, OperatorKind.BINARY_AND);
        put(BinaryExpr.Operator.BINARY_OR, OperatorKind.BINARY_OR);
        put(BinaryExpr.Operator.XOR, OperatorKind.XOR);
        put(BinaryExpr.Operator.LEFT_SHIFT, OperatorKind.LEFT_SHIFT);
        put(BinaryExpr.Operator.SIGNED_RIGHT_SHIFT, OperatorKind.SIGNED_RIGHT_SHIFT);
        put(BinaryExpr.Operator.UNSIGNED_RIGHT_SHIFT, OperatorKind.UNSIGNED_RIGHT_SHIFT);
    }

    private OperatorMapping() {}

    private static void put(BinaryExpr.Operator operator, OperatorKind kind) {
        KINDS.put(operator, kind);
        OPERATORS.put(kind, operator);
    }

    public static OperatorKind toKind(BinaryExpr.Operator operator) {
        OperatorKind kind = KINDS.get(operator);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operator);
        }
        return kind;
    }

    public static BinaryExpr.Operator toOperator(OperatorKind kind) {
        BinaryExpr.Operator operator = OPERATORS.get(kind);
        if (operator == null) {
            throw new IllegalArgumentException("No Java operator for: " + kind);
        }
        return operator;
    }
}
