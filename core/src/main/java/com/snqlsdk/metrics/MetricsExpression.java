package com.snqlsdk.metrics;

import com.snqlsdk.expression.Expression;

import java.util.List;

/**
 * The query of a {@link MetricsQuery}: a single {@link Timeseries} or a
 * {@link Formula} combining several.
 *
 * <p>Both carry their own tag filters and group-by columns, which apply to
 * everything beneath them.
 */
public sealed interface MetricsExpression extends FormulaParameter permits Timeseries, Formula {

    /**
     * Returns the tag filters, combined with AND.
     *
     * @return conditions or boolean groups
     */
    List<Expression> filters();

    /**
     * Returns the group-by columns.
     *
     * @return columns or aliased columns
     */
    List<Expression> groupby();

    MetricsExpression setFilters(List<? extends Expression> filters);

    MetricsExpression setGroupby(List<? extends Expression> groupby);
}
