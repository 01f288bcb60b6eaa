package com.snqlsdk.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Traversal helpers over expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {} // Utility class

    /**
     * Flattens a condition list into the conditions that always apply: the
     * members of the list itself and of every nested {@code AND} group. Members
     * of {@code OR} groups are not included, and an {@code OR} group itself is
     * returned as a single element.
     *
     * @param conditions the where or having clause
     * @return the top-level conditions, in order
     */
    public static List<Expression> topLevelConditions(Collection<? extends Expression> conditions) {
        List<Expression> result = new ArrayList<>();
        for (Expression condition : conditions) {
            collectTopLevel(condition, result);
        }
        return result;
    }

    private static void collectTopLevel(Expression condition, List<Expression> result) {
        if (condition instanceof BooleanCondition
                && ((BooleanCondition) condition).op() == BooleanOp.AND) {
            for (Expression member : ((BooleanCondition) condition).conditions()) {
                collectTopLevel(member, result);
            }
        } else {
            result.add(condition);
        }
    }

    /**
     * Finds every column referenced anywhere in an expression.
     *
     * @param expression the root expression
     * @return the columns, in first-seen order
     */
    public static Set<Column> findColumns(Expression expression) {
        Set<Column> columns = new LinkedHashSet<>();
        collectColumns(expression, columns);
        return columns;
    }

    /**
     * Finds every column referenced anywhere in a list of expressions.
     *
     * @param expressions the expressions
     * @return the columns, in first-seen order
     */
    public static Set<Column> findColumns(Collection<? extends Expression> expressions) {
        Set<Column> columns = new LinkedHashSet<>();
        for (Expression expression : expressions) {
            collectColumns(expression, columns);
        }
        return columns;
    }

    private static void collectColumns(Expression expression, Set<Column> columns) {
        if (expression instanceof Column) {
            columns.add((Column) expression);
        } else if (expression instanceof AliasedExpression) {
            columns.add(((AliasedExpression) expression).expression());
        } else if (expression instanceof FunctionCall) {
            for (Expression parameter : ((FunctionCall) expression).parameters()) {
                collectColumns(parameter, columns);
            }
        } else if (expression instanceof CurriedFunction) {
            CurriedFunction curried = (CurriedFunction) expression;
            for (Expression initializer : curried.initializers()) {
                collectColumns(initializer, columns);
            }
            for (Expression parameter : curried.parameters()) {
                collectColumns(parameter, columns);
            }
        } else if (expression instanceof Condition) {
            Condition condition = (Condition) expression;
            collectColumns(condition.lhs(), columns);
            if (condition.rhs() != null) {
                collectColumns(condition.rhs(), columns);
            }
        } else if (expression instanceof BooleanCondition) {
            for (Expression member : ((BooleanCondition) expression).conditions()) {
                collectColumns(member, columns);
            }
        } else if (expression instanceof Lambda) {
            collectColumns(((Lambda) expression).body(), columns);
        }
        // ScalarLiteral and Identifier reference no columns
    }

    /**
     * Returns the name a select expression is visible as to an outer query:
     * the alias of a function or aliased column, or the name of a plain column.
     *
     * @param expression a select expression
     * @return the output name, or null if the expression has none
     */
    public static String outputName(Expression expression) {
        if (expression instanceof Column) {
            return ((Column) expression).name();
        } else if (expression instanceof AliasedExpression) {
            return ((AliasedExpression) expression).alias();
        } else if (expression instanceof FunctionCall) {
            return ((FunctionCall) expression).alias();
        } else if (expression instanceof CurriedFunction) {
            return ((CurriedFunction) expression).alias();
        }
        return null;
    }
}
