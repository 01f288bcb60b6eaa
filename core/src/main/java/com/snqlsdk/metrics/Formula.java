package com.snqlsdk.metrics;

import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.generator.MqlPrinter;
import com.snqlsdk.validation.Identifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An arithmetic expression over timeseries: {@code (sum(foo) / 1000)},
 * {@code apdex(sum(foo), 500)}, {@code topK(10)(sum(foo))}.
 *
 * <p>The function is one of the {@link ArithmeticOperator} names, rendered
 * infix, or any other function name, rendered as a (possibly curried) call.
 * Parameters are timeseries, nested formulas or numeric constants; at least one
 * must be non-constant. Nothing is evaluated here: the tree is built, validated
 * and printed for the engine to compute.
 *
 * <p>Filters and group-by columns on a formula apply to every timeseries below it.
 */
public final class Formula implements MetricsExpression {

    private final String function;
    private final List<ScalarLiteral> aggregateParams;
    private final List<FormulaParameter> parameters;
    private final List<Expression> filters;
    private final List<Expression> groupby;

    public Formula(String function, List<ScalarLiteral> aggregateParams,
                   List<? extends FormulaParameter> parameters,
                   List<? extends Expression> filters, List<? extends Expression> groupby) {
        Identifiers.checkFunctionName(function);
        this.function = function;
        this.aggregateParams = aggregateParams != null ? List.copyOf(aggregateParams) : List.of();
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.filters = Timeseries.checkFilters(filters, "Formula");
        this.groupby = Timeseries.checkGroupby(groupby, "Formula");
    }

    public Formula(ArithmeticOperator operator, List<? extends FormulaParameter> parameters) {
        this(operator.functionName(), null, parameters, null, null);
    }

    public Formula(String function, List<? extends FormulaParameter> parameters) {
        this(function, null, parameters, null, null);
    }

    public String function() {
        return function;
    }

    /**
     * Returns the arithmetic operator this formula applies.
     *
     * @return the operator, or null if the function is not arithmetic
     */
    public ArithmeticOperator operator() {
        return ArithmeticOperator.fromFunctionName(function);
    }

    public boolean isArithmetic() {
        return operator() != null;
    }

    public List<ScalarLiteral> aggregateParams() {
        return aggregateParams;
    }

    public List<FormulaParameter> parameters() {
        return parameters;
    }

    @Override
    public List<Expression> filters() {
        return filters;
    }

    @Override
    public List<Expression> groupby() {
        return groupby;
    }

    public Formula setParameters(List<? extends FormulaParameter> parameters) {
        return new Formula(function, aggregateParams, parameters, filters, groupby);
    }

    @Override
    public Formula setFilters(List<? extends Expression> filters) {
        return new Formula(function, aggregateParams, parameters, filters, groupby);
    }

    @Override
    public Formula setGroupby(List<? extends Expression> groupby) {
        return new Formula(function, aggregateParams, parameters, filters, groupby);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;
        Formula that = (Formula) obj;
        return function.equals(that.function) &&
               aggregateParams.equals(that.aggregateParams) &&
               parameters.equals(that.parameters) &&
               filters.equals(that.filters) &&
               groupby.equals(that.groupby);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, aggregateParams, parameters, filters, groupby);
    }

    @Override
    public String toString() {
        return MqlPrinter.toMql(this);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an arithmetic formula, converting plain numbers to constants.
     *
     * @param operator the operator
     * @param parameters timeseries, formulas, constants or {@link Number}s
     * @return the formula
     */
    public static Formula of(ArithmeticOperator operator, Object... parameters) {
        return new Formula(operator, toParameters(parameters));
    }

    /**
     * Creates a formula applying an arbitrary function, e.g. {@code apdex}.
     *
     * @param function the function name
     * @param parameters timeseries, formulas, constants or {@link Number}s
     * @return the formula
     */
    public static Formula of(String function, Object... parameters) {
        return new Formula(function, toParameters(parameters));
    }

    private static List<FormulaParameter> toParameters(Object... values) {
        List<FormulaParameter> parameters = new ArrayList<>(values.length);
        for (Object value : values) {
            if (value instanceof FormulaParameter) {
                parameters.add((FormulaParameter) value);
            } else if (value instanceof Double || value instanceof Float) {
                parameters.add(Constant.of(((Number) value).doubleValue()));
            } else if (value instanceof Number) {
                parameters.add(Constant.of(((Number) value).longValue()));
            } else {
                throw new IllegalArgumentException(
                    "parameter '" + value + "' must be a Timeseries, Formula or number");
            }
        }
        return parameters;
    }
}
