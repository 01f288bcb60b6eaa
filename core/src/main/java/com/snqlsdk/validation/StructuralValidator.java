package com.snqlsdk.validation;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.exception.InvalidQueryException;
import com.snqlsdk.expression.AliasedExpression;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.CurriedFunction;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.FunctionCall;
import com.snqlsdk.expression.Identifier;
import com.snqlsdk.expression.Lambda;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.OrderBy;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.logical.Join;
import com.snqlsdk.logical.MatchClause;
import com.snqlsdk.logical.Query;
import com.snqlsdk.logical.Relationship;
import com.snqlsdk.logical.Storage;
import com.snqlsdk.metrics.Constant;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.FormulaParameter;
import com.snqlsdk.metrics.MetricsExpression;
import com.snqlsdk.metrics.MetricsExpressions;
import com.snqlsdk.metrics.Timeseries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates the shape of a query tree without reference to any schema.
 *
 * <p>Validation rules:
 * <ul>
 *   <li><b>Names:</b> columns, aliases, functions, identifiers and entities
 *       match their character sets (see {@link Identifiers})</li>
 *   <li><b>Query:</b>
 *     <ul>
 *       <li>select is non-empty</li>
 *       <li>aliases are unique within select and within group by</li>
 *       <li>totals requires a group by</li>
 *       <li>limit, offset and granularity are within range</li>
 *       <li>an inner query is itself valid</li>
 *     </ul>
 *   </li>
 *   <li><b>Conditions:</b> the left side is a column or function; {@code IN}
 *       takes a sequence or a function; {@code LIKE} takes a string, column or
 *       function; unary operators take no right side</li>
 *   <li><b>Functions:</b> parameters are never conditions or aliased columns;
 *       curried initializers are scalars or columns</li>
 *   <li><b>Lambdas:</b> the body is a function</li>
 *   <li><b>Formulas:</b> at least one parameter, at least one of which is not a
 *       constant; arithmetic takes exactly two parameters; all bound metrics
 *       share one entity</li>
 * </ul>
 *
 * <p>The first violation found is thrown, as {@link InvalidQueryException} for
 * query-level rules and {@link InvalidExpressionException} for node rules.
 */
public final class StructuralValidator {

    private static final Logger logger = LoggerFactory.getLogger(StructuralValidator.class);

    private StructuralValidator() {} // Utility class

    // ==================== Queries ====================

    /**
     * Validates an event query and, recursively, its inner query.
     *
     * @param query the query
     * @throws InvalidExpressionException on the first violation
     */
    public static void validate(Query query) {
        Objects.requireNonNull(query, "query must not be null");

        validateMatch(query.match());

        if (query.select().isEmpty()) {
            throw new InvalidQueryException("query must have at least one expression in select", "select");
        }
        for (Expression expression : query.select()) {
            validate(expression);
        }
        checkUniqueAliases(query.select(), "select");

        for (Expression expression : query.groupby()) {
            validate(expression);
        }
        checkUniqueAliases(query.groupby(), "groupby");

        for (Column column : query.arrayJoin()) {
            validate(column);
        }
        validateConditions(query.where());
        validateConditions(query.having());
        for (OrderBy orderBy : query.orderby()) {
            validate(orderBy.expression());
        }
        if (query.limitby() != null) {
            for (Column column : query.limitby().columns()) {
                validate(column);
            }
        }

        if (query.totals() && query.groupby().isEmpty()) {
            throw new InvalidQueryException("totals is only valid with a groupby", "totals");
        }
        if (query.limit() != null) {
            Query.checkLimit(query.limit());
        }
        if (query.offset() != null) {
            Query.checkOffset(query.offset());
        }
        if (query.granularity() != null) {
            Query.checkGranularity(query.granularity());
        }
        logger.debug("Query passed structural validation");
    }

    private static void validateMatch(MatchClause match) {
        if (match instanceof Entity) {
            Identifiers.checkEntityName(((Entity) match).name());
        } else if (match instanceof Storage) {
            Identifiers.checkStorageName(((Storage) match).name());
        } else if (match instanceof Join) {
            for (Relationship relationship : ((Join) match).relationships()) {
                Identifiers.checkEntityName(relationship.lhs().name());
                Identifiers.checkEntityName(relationship.rhs().name());
            }
        } else if (match instanceof Query) {
            validate((Query) match);
        }
    }

    private static void checkUniqueAliases(List<Expression> expressions, String clause) {
        Set<String> seen = new HashSet<>();
        for (Expression expression : expressions) {
            String alias = aliasOf(expression);
            if (alias != null && !seen.add(alias)) {
                throw new InvalidQueryException(
                    "alias '" + alias + "' is defined more than once in " + clause, clause + "-alias");
            }
        }
    }

    private static String aliasOf(Expression expression) {
        if (expression instanceof AliasedExpression) {
            return ((AliasedExpression) expression).alias();
        } else if (expression instanceof FunctionCall) {
            return ((FunctionCall) expression).alias();
        } else if (expression instanceof CurriedFunction) {
            return ((CurriedFunction) expression).alias();
        }
        return null;
    }

    // ==================== Expressions ====================

    /**
     * Validates a where or having list: every element is a condition or boolean
     * group, and each is valid.
     *
     * @param conditions the conditions
     */
    public static void validateConditions(List<? extends Expression> conditions) {
        for (Expression condition : conditions) {
            if (!(condition instanceof Condition) && !(condition instanceof BooleanCondition)) {
                throw new InvalidExpressionException(
                    "expected a condition, found " + condition, "Condition", "condition-list");
            }
            validate(condition);
        }
    }

    /**
     * Validates a single expression tree.
     *
     * @param expression the expression
     */
    public static void validate(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");

        if (expression instanceof Column) {
            Identifiers.checkColumnName(((Column) expression).name());
        } else if (expression instanceof AliasedExpression) {
            AliasedExpression aliased = (AliasedExpression) expression;
            validate(aliased.expression());
            Identifiers.checkAlias(aliased.alias(), "AliasedExpression");
        } else if (expression instanceof FunctionCall) {
            validateFunction((FunctionCall) expression);
        } else if (expression instanceof CurriedFunction) {
            validateCurried((CurriedFunction) expression);
        } else if (expression instanceof Condition) {
            validateCondition((Condition) expression);
        } else if (expression instanceof BooleanCondition) {
            validateBoolean((BooleanCondition) expression);
        } else if (expression instanceof Lambda) {
            validateLambda((Lambda) expression);
        } else if (expression instanceof Identifier) {
            Identifiers.checkIdentifier(((Identifier) expression).name());
        }
        // ScalarLiteral: kind and homogeneity are fixed at construction
    }

    private static void validateFunction(FunctionCall function) {
        String node = "function " + function.name();
        Identifiers.checkFunctionName(function.name());
        validateParameters(function.parameters(), node);
        if (function.alias() != null) {
            Identifiers.checkAlias(function.alias(), node);
        }
    }

    private static void validateCurried(CurriedFunction function) {
        String node = "function " + function.name();
        Identifiers.checkFunctionName(function.name());
        for (Expression initializer : function.initializers()) {
            if (!(initializer instanceof ScalarLiteral) && !(initializer instanceof Column)) {
                throw new InvalidExpressionException(
                    "initializers of " + node + " must be scalars or columns, found " + initializer,
                    node, "curried-initializer");
            }
            validate(initializer);
        }
        validateParameters(function.parameters(), node);
        if (function.alias() != null) {
            Identifiers.checkAlias(function.alias(), node);
        }
    }

    private static void validateParameters(List<Expression> parameters, String node) {
        for (Expression parameter : parameters) {
            if (parameter instanceof Condition || parameter instanceof BooleanCondition
                    || parameter instanceof AliasedExpression) {
                throw new InvalidExpressionException(
                    "parameter " + parameter + " of " + node + " must not be a condition or an aliased expression",
                    node, "function-parameter");
            }
            validate(parameter);
        }
    }

    private static void validateCondition(Condition condition) {
        Expression lhs = condition.lhs();
        if (!(lhs instanceof Column) && !(lhs instanceof FunctionCall) && !(lhs instanceof CurriedFunction)) {
            throw new InvalidExpressionException(
                "left side of a condition must be a column or a function, found " + lhs,
                "Condition", "condition-lhs");
        }
        validate(lhs);

        Op op = condition.op();
        Expression rhs = condition.rhs();
        if (op.isUnary()) {
            if (rhs != null) {
                throw new InvalidExpressionException(
                    op.token() + " takes no right side", "Condition", "op-arity");
            }
            return;
        }
        if (rhs == null) {
            throw new InvalidExpressionException(op.token() + " requires a right side", "Condition", "op-arity");
        }
        if (op.isMembership() && !isSequence(rhs) && !isFunction(rhs)) {
            throw new InvalidExpressionException(
                op.token() + " requires an array, a tuple or a function on the right side, found " + rhs,
                "Condition", "condition-rhs");
        }
        if (op.isPattern() && !isString(rhs) && !(rhs instanceof Column) && !isFunction(rhs)) {
            throw new InvalidExpressionException(
                op.token() + " requires a string, a column or a function on the right side, found " + rhs,
                "Condition", "condition-rhs");
        }
        validate(rhs);
    }

    private static boolean isSequence(Expression expression) {
        return expression instanceof ScalarLiteral && ((ScalarLiteral) expression).kind().isSequence();
    }

    private static boolean isString(Expression expression) {
        return expression instanceof ScalarLiteral
            && ((ScalarLiteral) expression).kind() == ScalarLiteral.Kind.STRING;
    }

    private static boolean isFunction(Expression expression) {
        return expression instanceof FunctionCall || expression instanceof CurriedFunction;
    }

    private static void validateBoolean(BooleanCondition condition) {
        if (condition.conditions().size() < 2) {
            throw new InvalidExpressionException(
                condition.op().token() + " requires at least two conditions", "BooleanCondition", "boolean-arity");
        }
        validateConditions(condition.conditions());
    }

    private static void validateLambda(Lambda lambda) {
        for (String identifier : lambda.identifiers()) {
            Identifiers.checkIdentifier(identifier);
        }
        if (!isFunction(lambda.body())) {
            throw new InvalidExpressionException(
                "lambda body must be a function, found " + lambda.body(), "Lambda", "lambda-body");
        }
        validate(lambda.body());
    }

    // ==================== Metrics ====================

    /**
     * Validates a timeseries or formula tree.
     *
     * @param expression the metrics expression
     */
    public static void validate(MetricsExpression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        validateParameter(expression);

        Set<String> entities = MetricsExpressions.entities(expression);
        if (entities.size() > 1) {
            throw new InvalidExpressionException(
                "all metrics of a formula must be read from the same entity, found " + entities,
                "Formula", "formula-entity");
        }
    }

    private static void validateParameter(FormulaParameter parameter) {
        if (parameter instanceof Timeseries) {
            validateTimeseries((Timeseries) parameter);
        } else if (parameter instanceof Formula) {
            validateFormula((Formula) parameter);
        }
        // Constant: numeric by construction
    }

    private static void validateTimeseries(Timeseries timeseries) {
        Identifiers.checkFunctionName(timeseries.aggregate());
        validateMetricsClauses(timeseries);
    }

    private static void validateFormula(Formula formula) {
        Identifiers.checkFunctionName(formula.function());
        List<FormulaParameter> parameters = formula.parameters();
        if (parameters.isEmpty()) {
            throw new InvalidExpressionException(
                "formula " + formula.function() + " requires at least one parameter", "Formula", "formula-parameters");
        }
        boolean allConstant = true;
        for (FormulaParameter parameter : parameters) {
            if (!(parameter instanceof Constant)) {
                allConstant = false;
            }
        }
        if (allConstant) {
            throw new InvalidExpressionException(
                "formula " + formula.function() + " requires at least one timeseries or formula parameter",
                "Formula", "formula-parameters");
        }
        if (formula.isArithmetic() && parameters.size() != 2) {
            throw new InvalidExpressionException(
                "arithmetic formula " + formula.function() + " requires exactly two parameters, found " +
                parameters.size(), "Formula", "formula-arity");
        }
        for (FormulaParameter parameter : parameters) {
            validateParameter(parameter);
        }
        validateMetricsClauses(formula);
    }

    private static void validateMetricsClauses(MetricsExpression expression) {
        validateConditions(expression.filters());
        for (Expression column : expression.groupby()) {
            validate(column);
        }
        checkUniqueAliases(expression.groupby(), "groupby");
    }
}
