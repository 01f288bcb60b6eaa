package com.snqlsdk.metrics;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.expression.ScalarLiteral;

import java.util.Objects;

/**
 * A numeric constant operand of a {@link Formula}, e.g. the {@code 1000} in
 * {@code sum(transaction.duration) / 1000}.
 */
public final class Constant implements FormulaParameter {

    private final ScalarLiteral value;

    /**
     * Wraps a numeric literal.
     *
     * @param value an INTEGER or FLOAT literal
     * @throws InvalidExpressionException for any other kind
     */
    public Constant(ScalarLiteral value) {
        Objects.requireNonNull(value, "value must not be null");
        if (!value.kind().isNumeric()) {
            throw new InvalidExpressionException(
                "formula constant must be numeric, got " + value.kind(), "Formula", "formula-constant");
        }
        this.value = value;
    }

    public ScalarLiteral value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        return value.equals(((Constant) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }

    public static Constant of(long value) {
        return new Constant(ScalarLiteral.of(value));
    }

    public static Constant of(double value) {
        return new Constant(ScalarLiteral.of(value));
    }
}
