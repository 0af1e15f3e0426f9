package org.introspect.classify;

import java.util.Objects;
import java.util.Optional;

import org.introspect.tree.BinaryNode;
import org.introspect.tree.ExpressionNode;
import org.introspect.tree.LogicalAnd;
import org.introspect.tree.LogicalOr;

/**
 * Decides the rendering role of a condition node from the operator table. A binary node whose operator
 * has no glyph in the table is treated as a leaf and is never decomposed.
 */
public final class ExpressionClassifier {

    private final OperatorTable table;

    public ExpressionClassifier(OperatorTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public Classification classify(ExpressionNode<?> node) {
        if (!(node instanceof BinaryNode<?> binary)) {
            return Classification.leaf();
        }
        Optional<String> glyph = table.glyph(binary.operator());
        if (glyph.isEmpty()) {
            return Classification.leaf();
        }
        if (binary instanceof LogicalAnd<?>) {
            return Classification.logicalAnd(glyph.get());
        }
        if (binary instanceof LogicalOr<?>) {
            return Classification.logicalOr(glyph.get());
        }
        return Classification.binaryOperator(glyph.get());
    }

    public OperatorTable getTable() {
        return table;
    }
}
