package org.introspect.tree;

public sealed interface BinaryNode<E> extends ExpressionNode<E> permits Comparison, Arithmetic, LogicalAnd, LogicalOr {

    OperatorKind operator();

    ExpressionNode<E> left();

    ExpressionNode<E> right();
}
