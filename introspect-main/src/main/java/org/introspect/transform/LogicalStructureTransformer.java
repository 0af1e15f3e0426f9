package org.introspect.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.introspect.capture.CapturedOperand;
import org.introspect.host.HostTreeBuilder;
import org.introspect.render.MessageRenderer;
import org.introspect.render.RenderBounds;
import org.introspect.render.RenderFragment;

/**
 * Builds the failure-path code of a captured condition.
 * <p>
 * The generated control flow mirrors short-circuit evaluation:
 * <ul>
 *     <li>a leaf renders its cached value;</li>
 *     <li>a binary operator renders both operands around its glyph, parenthesizing operands that are
 *     themselves operators;</li>
 *     <li>{@code a && b} branches on the cached value of {@code a}: when false only {@code a} is rendered,
 *     since {@code b} never ran; when true {@code (...) && (b)} is rendered;</li>
 *     <li>{@code a || b} branches on its own cached value: when true nothing is rendered, when false both
 *     operands ran and {@code (a) || (b)} is rendered.</li>
 * </ul>
 * Branch decisions only read values captured during the truth test, so no operand is evaluated again and
 * no operand that was skipped is ever read. Consecutive static pieces are merged into one fragment.
 */
public final class LogicalStructureTransformer<E, S> {

    static final String CONTINUATION = "(...) ";

    private final HostTreeBuilder<E, S> host;
    private final RenderBounds bounds;

    private boolean truncated = false;

    public LogicalStructureTransformer(HostTreeBuilder<E, S> host, RenderBounds bounds) {
        this.host = Objects.requireNonNull(host, "host");
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    public S transform(CapturedOperand<E> root) {
        Emission emission = new Emission();
        render(root, emission);
        return emission.build();
    }

    /**
     * Whether any static fragment built so far had to be cut down to respect the render bounds.
     */
    public boolean isTruncated() {
        return truncated;
    }

    private void render(CapturedOperand<E> operand, Emission out) {
        switch (operand.classification().kind()) {
            case LEAF -> out.value(host.read(operand.slot()));
            case BINARY_OPERATOR -> {
                renderOperand(operand.left(), out);
                out.text(" " + operand.classification().glyph() + " ");
                renderOperand(operand.right(), out);
            }
            case LOGICAL_AND -> renderAnd(operand, out);
            case LOGICAL_OR -> renderOr(operand, out);
        }
    }

    private void renderAnd(CapturedOperand<E> operand, Emission out) {
        Emission leftFailed = new Emission();
        render(operand.left(), leftFailed);

        Emission rightFailed = new Emission();
        rightFailed.text(CONTINUATION + operand.classification().glyph() + " (");
        render(operand.right(), rightFailed);
        rightFailed.text(")");

        out.statement(host.branch(host.truth(operand.left().slot()), rightFailed.build(), leftFailed.build()));
    }

    private void renderOr(CapturedOperand<E> operand, Emission out) {
        Emission bothFailed = new Emission();
        bothFailed.text("(");
        render(operand.left(), bothFailed);
        bothFailed.text(") " + operand.classification().glyph() + " (");
        render(operand.right(), bothFailed);
        bothFailed.text(")");

        out.statement(host.branch(host.truth(operand.slot()), new Emission().build(), bothFailed.build()));
    }

    // operands of a binary operator were always evaluated, so a logical operand is shown by its value
    private void renderOperand(CapturedOperand<E> operand, Emission out) {
        if (operand.isLeaf() || operand.classification().isLogical()) {
            out.value(host.read(operand.slot()));
        } else {
            out.text("(");
            render(operand, out);
            out.text(")");
        }
    }

    /**
     * Statements of one branch, with the pending static pieces merged into a single fragment.
     */
    private final class Emission {

        private final List<S> statements = new ArrayList<>();
        private MessageRenderer<E> pending = new MessageRenderer<>(bounds);

        void text(String text) {
            pending.text(text);
        }

        void value(E reference) {
            pending.value(reference);
        }

        void statement(S statement) {
            flush();
            statements.add(statement);
        }

        S build() {
            flush();
            return host.sequence(statements);
        }

        private void flush() {
            if (pending.isEmpty()) {
                return;
            }
            RenderFragment<E> fragment = pending.build();
            truncated |= fragment.truncated();
            statements.add(host.append(fragment));
            pending = new MessageRenderer<>(bounds);
        }
    }
}
