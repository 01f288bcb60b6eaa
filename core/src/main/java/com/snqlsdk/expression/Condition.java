package com.snqlsdk.expression;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.generator.ExpressionTranslator;

import java.util.Objects;

/**
 * A single comparison: {@code project_id IN (1, 2)}, {@code message LIKE '%oom%'},
 * {@code release IS NULL}.
 *
 * <p>The constructor enforces the operator's arity; unary operators have no
 * right-hand side. Operand types are checked by the structural validator.
 */
public final class Condition implements Expression {

    private final Expression lhs;
    private final Op op;
    private final Expression rhs; // null for unary operators

    /**
     * Creates a condition.
     *
     * @param lhs the left operand (a column or function)
     * @param op the operator
     * @param rhs the right operand, null for unary operators
     * @throws InvalidExpressionException if the operand count does not match the operator
     */
    public Condition(Expression lhs, Op op, Expression rhs) {
        this.lhs = Objects.requireNonNull(lhs, "lhs must not be null");
        this.op = Objects.requireNonNull(op, "op must not be null");
        if (op.isUnary() && rhs != null) {
            throw new InvalidExpressionException(
                "invalid condition: unary operator " + op.token() + " takes no right-hand side",
                "Condition", "op-arity");
        }
        if (!op.isUnary() && rhs == null) {
            throw new InvalidExpressionException(
                "invalid condition: operator " + op.token() + " requires a right-hand side",
                "Condition", "op-arity");
        }
        this.rhs = rhs;
    }

    /**
     * Creates a condition with a unary operator.
     *
     * @param lhs the operand
     * @param op a unary operator
     */
    public Condition(Expression lhs, Op op) {
        this(lhs, op, null);
    }

    public Expression lhs() {
        return lhs;
    }

    public Op op() {
        return op;
    }

    /**
     * Returns the right operand.
     *
     * @return the right operand, or null for unary operators
     */
    public Expression rhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Condition)) return false;
        Condition that = (Condition) obj;
        return lhs.equals(that.lhs) && op == that.op && Objects.equals(rhs, that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, op, rhs);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a condition, converting a plain Java right-hand side to a literal.
     *
     * @param lhs the left operand
     * @param op the operator
     * @param rhs an expression or a value accepted by {@link ScalarLiteral#from(Object)}
     * @return the condition
     */
    public static Condition of(Expression lhs, Op op, Object rhs) {
        Expression right = rhs instanceof Expression ? (Expression) rhs : ScalarLiteral.from(rhs);
        return new Condition(lhs, op, right);
    }

    public static Condition isNull(Expression lhs) {
        return new Condition(lhs, Op.IS_NULL);
    }

    public static Condition isNotNull(Expression lhs) {
        return new Condition(lhs, Op.IS_NOT_NULL);
    }
}
