package com.snqlsdk.expression;

import java.util.Objects;

/**
 * One sort key of the {@code ORDER BY} clause.
 */
public final class OrderBy {

    private final Expression expression;
    private final Direction direction;

    public OrderBy(Expression expression, Direction direction) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public Direction direction() {
        return direction;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrderBy)) return false;
        OrderBy that = (OrderBy) obj;
        return expression.equals(that.expression) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, direction);
    }

    @Override
    public String toString() {
        return expression + " " + direction;
    }

    public static OrderBy asc(Expression expression) {
        return new OrderBy(expression, Direction.ASC);
    }

    public static OrderBy desc(Expression expression) {
        return new OrderBy(expression, Direction.DESC);
    }
}
