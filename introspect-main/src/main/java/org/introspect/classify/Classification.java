package org.introspect.classify;

import java.util.Objects;

/**
 * How a condition node takes part in failure rendering.
 *
 * @param kind  the rendering role of the node
 * @param glyph the operator's display glyph, {@code null} for leaves
 */
public record Classification(Kind kind, String glyph) {

    public enum Kind {
        LEAF,
        BINARY_OPERATOR,
        LOGICAL_AND,
        LOGICAL_OR
    }

    private static final Classification LEAF = new Classification(Kind.LEAF, null);

    public Classification {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.LEAF) != (glyph == null)) {
            throw new IllegalArgumentException("Leaves have no glyph, operators need one: " + kind + " '" + glyph + "'");
        }
    }

    public static Classification leaf() {
        return LEAF;
    }

    public static Classification binaryOperator(String glyph) {
        return new Classification(Kind.BINARY_OPERATOR, glyph);
    }

    public static Classification logicalAnd(String glyph) {
        return new Classification(Kind.LOGICAL_AND, glyph);
    }

    public static Classification logicalOr(String glyph) {
        return new Classification(Kind.LOGICAL_OR, glyph);
    }

    public boolean isLeaf() {
        return kind == Kind.LEAF;
    }

    public boolean isLogical() {
        return kind == Kind.LOGICAL_AND || kind == Kind.LOGICAL_OR;
    }
}
