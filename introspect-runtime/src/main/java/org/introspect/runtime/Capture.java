package org.introspect.runtime;

import java.util.function.Supplier;

/**
 * A single-use memoization cell for one operand of an instrumented assertion condition.
 * <p>
 * Instrumented code declares one cell per operand, inside the block that performs a single check,
 * and fills it the first time the operand is evaluated. The failure path later reads the cached value
 * instead of evaluating the operand again. A cell is never shared between checks, occurrences or threads.
 * <p>
 * The {@code record} overloads return their argument unchanged. Overload resolution picks the primitive
 * variant for primitive operands and the generic variant for references, so wrapping an operand never
 * changes its static type.
 */
public final class Capture {

    private boolean filled = false;
    private Object value = null;

    public boolean record(boolean operand) {
        fill(operand);
        return operand;
    }

    public byte record(byte operand) {
        fill(operand);
        return operand;
    }

    public short record(short operand) {
        fill(operand);
        return operand;
    }

    public char record(char operand) {
        fill(operand);
        return operand;
    }

    public int record(int operand) {
        fill(operand);
        return operand;
    }

    public long record(long operand) {
        fill(operand);
        return operand;
    }

    public float record(float operand) {
        fill(operand);
        return operand;
    }

    public double record(double operand) {
        fill(operand);
        return operand;
    }

    public <T> T record(T operand) {
        fill(operand);
        return operand;
    }

    /**
     * Lazy access: evaluates the operand on the first call only and returns the cached value afterwards.
     */
    public Object evaluate(Supplier<?> operand) {
        if (!filled) {
            fill(operand.get());
        }
        return value;
    }

    /**
     * Returns the cached value.
     *
     * @throws IllegalStateException if the operand was never evaluated during this check
     */
    public Object get() {
        if (!filled) {
            throw new IllegalStateException("Operand was not evaluated during this check");
        }
        return value;
    }

    /**
     * Returns the cached value of a boolean operand.
     *
     * @throws IllegalStateException if the operand was never evaluated or is not a boolean
     */
    public boolean truth() {
        Object cached = get();
        if (!(cached instanceof Boolean)) {
            throw new IllegalStateException("Operand value " + cached + " is not a boolean");
        }
        return (Boolean) cached;
    }

    public boolean isFilled() {
        return filled;
    }

    private void fill(Object operand) {
        if (filled) {
            throw new IllegalStateException("Operand evaluated twice during one check");
        }
        value = operand;
        filled = true;
    }

    @Override
    public String toString() {
        return filled ? "Capture{" + value + '}' : "Capture{<empty>}";
    }
}
