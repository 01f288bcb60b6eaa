package com.snqlsdk.expression;

import com.snqlsdk.config.QueryLimits;
import com.snqlsdk.exception.InvalidExpressionException;

import java.util.List;
import java.util.Objects;

/**
 * The {@code LIMIT n BY a, b} clause: at most {@code count} rows per distinct
 * combination of the given columns.
 */
public final class LimitBy {

    private final List<Column> columns;
    private final int count;

    public LimitBy(List<Column> columns, int count) {
        Objects.requireNonNull(columns, "columns must not be null");
        if (columns.isEmpty()) {
            throw new InvalidExpressionException(
                "LimitBy requires at least one column", "LimitBy", "limitby-columns");
        }
        if (count < QueryLimits.MIN_LIMIT || count > QueryLimits.MAX_LIMIT_BY) {
            throw new InvalidExpressionException(
                "limitby count '" + count + "' must be between " + QueryLimits.MIN_LIMIT +
                " and " + QueryLimits.MAX_LIMIT_BY, "LimitBy", "limitby-count");
        }
        this.columns = List.copyOf(columns);
        this.count = count;
    }

    public List<Column> columns() {
        return columns;
    }

    public int count() {
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LimitBy)) return false;
        LimitBy that = (LimitBy) obj;
        return count == that.count && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, count);
    }

    @Override
    public String toString() {
        return "LimitBy(" + count + ", " + columns + ")";
    }
}
