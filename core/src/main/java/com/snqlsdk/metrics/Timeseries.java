package com.snqlsdk.metrics;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.expression.AliasedExpression;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.generator.MqlPrinter;
import com.snqlsdk.validation.Identifiers;

import java.util.List;
import java.util.Objects;

/**
 * A single timeseries: a metric aggregated by a function, optionally filtered
 * by tag conditions and grouped by tags.
 *
 * <p>MQL form: {@code quantiles(0.5)(d:transactions/duration@millisecond){release:"1.0"} by (transaction)}.
 */
public final class Timeseries implements MetricsExpression {

    private final Metric metric;
    private final String aggregate;
    private final List<ScalarLiteral> aggregateParams;
    private final List<Expression> filters;
    private final List<Expression> groupby;

    public Timeseries(Metric metric, String aggregate, List<ScalarLiteral> aggregateParams,
                      List<? extends Expression> filters, List<? extends Expression> groupby) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (aggregate == null || aggregate.isEmpty()) {
            throw new InvalidExpressionException("aggregate must be a non-empty string", "Timeseries", "aggregate");
        }
        Identifiers.checkFunctionName(aggregate);
        this.aggregate = aggregate;
        this.aggregateParams = aggregateParams != null ? List.copyOf(aggregateParams) : List.of();
        for (ScalarLiteral param : this.aggregateParams) {
            if (param.kind().isSequence()) {
                throw new InvalidExpressionException(
                    "aggregate_params can only be literal types", "Timeseries", "aggregate-params");
            }
        }
        this.filters = checkFilters(filters, "Timeseries");
        this.groupby = checkGroupby(groupby, "Timeseries");
    }

    public Timeseries(Metric metric, String aggregate) {
        this(metric, aggregate, null, null, null);
    }

    static List<Expression> checkFilters(List<? extends Expression> filters, String node) {
        if (filters == null) {
            return List.of();
        }
        for (Expression filter : filters) {
            if (!(filter instanceof Condition) && !(filter instanceof BooleanCondition)) {
                throw new InvalidExpressionException(
                    "filters must be a list of Conditions", node, "filters");
            }
        }
        return List.copyOf(filters);
    }

    static List<Expression> checkGroupby(List<? extends Expression> groupby, String node) {
        if (groupby == null) {
            return List.of();
        }
        for (Expression column : groupby) {
            if (!(column instanceof Column) && !(column instanceof AliasedExpression)) {
                throw new InvalidExpressionException(
                    "groupby must be a list of Columns or AliasedExpression", node, "groupby");
            }
        }
        return List.copyOf(groupby);
    }

    public Metric metric() {
        return metric;
    }

    public String aggregate() {
        return aggregate;
    }

    public List<ScalarLiteral> aggregateParams() {
        return aggregateParams;
    }

    @Override
    public List<Expression> filters() {
        return filters;
    }

    @Override
    public List<Expression> groupby() {
        return groupby;
    }

    public Timeseries setMetric(Metric metric) {
        return new Timeseries(metric, aggregate, aggregateParams, filters, groupby);
    }

    public Timeseries setAggregate(String aggregate, List<ScalarLiteral> aggregateParams) {
        return new Timeseries(metric, aggregate, aggregateParams, filters, groupby);
    }

    @Override
    public Timeseries setFilters(List<? extends Expression> filters) {
        return new Timeseries(metric, aggregate, aggregateParams, filters, groupby);
    }

    @Override
    public Timeseries setGroupby(List<? extends Expression> groupby) {
        return new Timeseries(metric, aggregate, aggregateParams, filters, groupby);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Timeseries)) return false;
        Timeseries that = (Timeseries) obj;
        return metric.equals(that.metric) &&
               aggregate.equals(that.aggregate) &&
               aggregateParams.equals(that.aggregateParams) &&
               filters.equals(that.filters) &&
               groupby.equals(that.groupby);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, aggregate, aggregateParams, filters, groupby);
    }

    @Override
    public String toString() {
        return MqlPrinter.toMql(this);
    }
}
