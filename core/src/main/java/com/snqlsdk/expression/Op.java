package com.snqlsdk.expression;

/**
 * Comparison operators usable in a {@link Condition}.
 *
 * <p>Each operator has a fixed rendering token and a fixed operand contract:
 * unary operators take no right-hand side, {@code IN}/{@code NOT IN} need an
 * iterable right-hand side and {@code LIKE}/{@code NOT LIKE} need a string.
 */
public enum Op {
    GT(">", Arity.BINARY),
    LT("<", Arity.BINARY),
    GTE(">=", Arity.BINARY),
    LTE("<=", Arity.BINARY),
    EQ("=", Arity.BINARY),
    NEQ("!=", Arity.BINARY),
    IN("IN", Arity.BINARY),
    NOT_IN("NOT IN", Arity.BINARY),
    LIKE("LIKE", Arity.BINARY),
    NOT_LIKE("NOT LIKE", Arity.BINARY),
    IS_NULL("IS NULL", Arity.UNARY),
    IS_NOT_NULL("IS NOT NULL", Arity.UNARY);

    /**
     * Number of operands an operator takes.
     */
    public enum Arity {
        UNARY,
        BINARY
    }

    private final String token;
    private final Arity arity;

    Op(String token, Arity arity) {
        this.token = token;
        this.arity = arity;
    }

    /**
     * Returns the token this operator renders as in the event dialect.
     *
     * @return the token, e.g. "NOT IN"
     */
    public String token() {
        return token;
    }

    public Arity arity() {
        return arity;
    }

    public boolean isUnary() {
        return arity == Arity.UNARY;
    }

    /**
     * Returns true for operators whose right-hand side is a set of values.
     */
    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Returns true for pattern-matching operators.
     */
    public boolean isPattern() {
        return this == LIKE || this == NOT_LIKE;
    }

    /**
     * Returns true for operators that negate their positive counterpart.
     */
    public boolean isNegated() {
        return this == NEQ || this == NOT_IN || this == NOT_LIKE || this == IS_NOT_NULL;
    }

    @Override
    public String toString() {
        return token;
    }
}
