package org.introspect.tree;

import java.util.Objects;

public record LogicalOr<E>(ExpressionNode<E> left, ExpressionNode<E> right, E source) implements BinaryNode<E> {

    public LogicalOr {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public OperatorKind operator() {
        return OperatorKind.OR;
    }
}
