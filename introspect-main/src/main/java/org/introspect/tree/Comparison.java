package org.introspect.tree;

import java.util.Objects;

public record Comparison<E>(OperatorKind operator, ExpressionNode<E> left, ExpressionNode<E> right, E source)
        implements BinaryNode<E> {

    public Comparison {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(source, "source");
        if (operator.category() != OperatorKind.Category.COMPARISON) {
            throw new IllegalArgumentException(operator + " is not a comparison operator");
        }
    }
}
