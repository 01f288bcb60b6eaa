package com.snqlsdk.expression;

/**
 * Operators combining conditions in a {@link BooleanCondition}.
 */
public enum BooleanOp {
    AND,
    OR;

    public String token() {
        return name();
    }
}
