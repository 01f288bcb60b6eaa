package com.snqlsdk.optimizer;

import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.BooleanOp;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.logical.Query;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.FormulaParameter;
import com.snqlsdk.metrics.MetricsExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code a = 1 OR a = 2 OR a = 3} into {@code a IN (1, 2, 3)}.
 *
 * <p>An {@code OR} group qualifies when every member is an {@code =} condition on
 * the same left side with a scalar right side. Groups nested in {@code AND}
 * groups are rewritten too; anything else is left as is. The input tree is
 * never modified: a new query or expression is returned when something changed,
 * the same instance otherwise.
 */
public final class OrToInOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(OrToInOptimizer.class);

    private OrToInOptimizer() {} // Utility class

    /**
     * Optimizes the where and having clauses of an event query.
     *
     * @param query the query
     * @return the optimized query
     */
    public static Query optimize(Query query) {
        List<Expression> where = optimizeAll(query.where());
        List<Expression> having = optimizeAll(query.having());
        if (where == query.where() && having == query.having()) {
            return query;
        }
        logger.debug("Rewrote OR of equalities into IN");
        Query optimized = query;
        if (where != query.where()) {
            optimized = optimized.setWhere(where);
        }
        if (having != query.having()) {
            optimized = optimized.setHaving(having);
        }
        return optimized;
    }

    /**
     * Optimizes the filters of a timeseries or formula and of everything below it.
     *
     * @param expression the expression
     * @return the optimized expression
     */
    public static MetricsExpression optimize(MetricsExpression expression) {
        MetricsExpression optimized = expression;
        if (expression instanceof Formula) {
            Formula formula = (Formula) expression;
            List<FormulaParameter> parameters = new ArrayList<>();
            boolean changed = false;
            for (FormulaParameter parameter : formula.parameters()) {
                FormulaParameter result = parameter instanceof MetricsExpression
                    ? optimize((MetricsExpression) parameter)
                    : parameter;
                changed |= result != parameter;
                parameters.add(result);
            }
            if (changed) {
                optimized = formula.setParameters(parameters);
            }
        }
        List<Expression> filters = optimizeAll(optimized.filters());
        return filters == optimized.filters() ? optimized : optimized.setFilters(filters);
    }

    private static List<Expression> optimizeAll(List<Expression> conditions) {
        List<Expression> result = new ArrayList<>(conditions.size());
        boolean changed = false;
        for (Expression condition : conditions) {
            Expression optimized = optimizeCondition(condition);
            changed |= optimized != condition;
            result.add(optimized);
        }
        return changed ? result : conditions;
    }

    private static Expression optimizeCondition(Expression expression) {
        if (!(expression instanceof BooleanCondition)) {
            return expression;
        }
        BooleanCondition group = (BooleanCondition) expression;
        if (group.op() == BooleanOp.OR) {
            Condition merged = mergeEqualities(group);
            if (merged != null) {
                return merged;
            }
        }
        List<Expression> members = optimizeAll(group.conditions());
        return members == group.conditions() ? group : new BooleanCondition(group.op(), members);
    }

    private static Condition mergeEqualities(BooleanCondition group) {
        Expression lhs = null;
        List<ScalarLiteral> values = new ArrayList<>();
        for (Expression member : group.conditions()) {
            if (!(member instanceof Condition)) {
                return null;
            }
            Condition condition = (Condition) member;
            if (condition.op() != Op.EQ || !(condition.rhs() instanceof ScalarLiteral)
                    || ((ScalarLiteral) condition.rhs()).kind().isSequence()) {
                return null;
            }
            if (lhs == null) {
                lhs = condition.lhs();
            } else if (!lhs.equals(condition.lhs())) {
                return null;
            }
            values.add((ScalarLiteral) condition.rhs());
        }
        return new Condition(lhs, Op.IN, ScalarLiteral.tuple(values));
    }
}
