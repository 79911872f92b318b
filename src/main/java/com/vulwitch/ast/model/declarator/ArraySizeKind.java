package com.vulwitch.ast.model.declarator;

public enum ArraySizeKind {
    /** {@code []} */
    UNKNOWN,
    /** {@code [*]} */
    VARIABLE_UNKNOWN,
    /** {@code [n]} */
    VARIABLE_EXPRESSION,
    /** {@code [static n]} */
    STATIC_EXPRESSION;

    public boolean hasExpression() {
        return this == VARIABLE_EXPRESSION || this == STATIC_EXPRESSION;
    }
}
