package org.introspect.tree;

/**
 * Immutable snapshot of an assertion condition, built bottom-up from the host's expression tree.
 *
 * @param <E> the host's expression type; every node keeps the host expression it was read from so that
 *            an opaque node can be captured as a single unit
 */
public sealed interface ExpressionNode<E> permits Leaf, BinaryNode {

    E source();
}
