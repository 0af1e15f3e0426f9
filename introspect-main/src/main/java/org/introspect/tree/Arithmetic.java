package org.introspect.tree;

import java.util.Objects;

public record Arithmetic<E>(OperatorKind operator, ExpressionNode<E> left, ExpressionNode<E> right, E source)
        implements BinaryNode<E> {

    public Arithmetic {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(source, "source");
        if (operator.category() != OperatorKind.Category.ARITHMETIC) {
            throw new IllegalArgumentException(operator + " is not an arithmetic operator");
        }
    }
}
