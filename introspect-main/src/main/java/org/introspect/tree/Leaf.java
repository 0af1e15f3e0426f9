package org.introspect.tree;

import java.util.Objects;

/**
 * A value-producing unit that is never decomposed: calls, names, literals, field accesses, unary operators...
 */
public record Leaf<E>(E source) implements ExpressionNode<E> {

    public Leaf {
        Objects.requireNonNull(source, "source");
    }
}
