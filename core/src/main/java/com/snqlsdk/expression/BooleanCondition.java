package com.snqlsdk.expression;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.generator.ExpressionTranslator;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Conditions combined with {@code AND} or {@code OR}. Groups nest to any depth.
 *
 * <p>A group always has at least two members; each member is a
 * {@link Condition} or another {@link BooleanCondition}.
 */
public final class BooleanCondition implements Expression {

    private final BooleanOp op;
    private final List<Expression> conditions;

    public BooleanCondition(BooleanOp op, List<? extends Expression> conditions) {
        this.op = Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(conditions, "conditions must not be null");
        if (conditions.size() < 2) {
            throw new InvalidExpressionException(
                "invalid boolean condition: " + op + " requires at least two conditions",
                "BooleanCondition", "boolean-arity");
        }
        for (Expression condition : conditions) {
            if (!(condition instanceof Condition) && !(condition instanceof BooleanCondition)) {
                throw new InvalidExpressionException(
                    "invalid boolean condition: " + condition + " is not a condition",
                    "BooleanCondition", "boolean-member");
            }
        }
        this.conditions = List.copyOf(conditions);
    }

    public BooleanOp op() {
        return op;
    }

    public List<Expression> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BooleanCondition)) return false;
        BooleanCondition that = (BooleanCondition) obj;
        return op == that.op && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, conditions);
    }

    // ==================== Factory Methods ====================

    public static BooleanCondition and(Expression... conditions) {
        return new BooleanCondition(BooleanOp.AND, Arrays.asList(conditions));
    }

    public static BooleanCondition or(Expression... conditions) {
        return new BooleanCondition(BooleanOp.OR, Arrays.asList(conditions));
    }
}
