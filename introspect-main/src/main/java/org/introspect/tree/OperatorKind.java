package org.introspect.tree;

/**
 * Every binary operator an assertion condition can contain, grouped by category.
 * Whether an operator is decomposed in failure messages is decided by the operator table, not here.
 */
public enum OperatorKind {

    EQUALS(Category.COMPARISON),
    NOT_EQUALS(Category.COMPARISON),
    LESS(Category.COMPARISON),
    GREATER(Category.COMPARISON),
    LESS_EQUALS(Category.COMPARISON),
    GREATER_EQUALS(Category.COMPARISON),

    PLUS(Category.ARITHMETIC),
    MINUS(Category.ARITHMETIC),
    MULTIPLY(Category.ARITHMETIC),
    DIVIDE(Category.ARITHMETIC),
    REMAINDER(Category.ARITHMETIC),
    BINARY_AND(Category.ARITHMETIC),
    BINARY_OR(Category.ARITHMETIC),
    XOR(Category.ARITHMETIC),
    LEFT_SHIFT(Category.ARITHMETIC),
    SIGNED_RIGHT_SHIFT(Category.ARITHMETIC),
    UNSIGNED_RIGHT_SHIFT(Category.ARITHMETIC),

    AND(Category.LOGICAL),
    OR(Category.LOGICAL);

    public enum Category {
        COMPARISON,
        ARITHMETIC,
        LOGICAL
    }

    private final Category category;

    OperatorKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
