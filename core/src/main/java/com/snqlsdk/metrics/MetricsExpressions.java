package com.snqlsdk.metrics;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Utility methods for walking metrics expression trees.
 */
public final class MetricsExpressions {

    private MetricsExpressions() {} // Utility class

    /**
     * Collects every timeseries in an expression tree, depth first, left to right.
     *
     * @param parameter a timeseries, formula or constant
     * @return the timeseries found, empty for a constant
     */
    public static List<Timeseries> timeseries(FormulaParameter parameter) {
        Objects.requireNonNull(parameter, "parameter must not be null");
        List<Timeseries> found = new ArrayList<>();
        collect(parameter, found);
        return found;
    }

    private static void collect(FormulaParameter parameter, List<Timeseries> found) {
        if (parameter instanceof Timeseries) {
            found.add((Timeseries) parameter);
        } else if (parameter instanceof Formula) {
            for (FormulaParameter child : ((Formula) parameter).parameters()) {
                collect(child, found);
            }
        }
    }

    /**
     * Returns the distinct entities the metrics of an expression are bound to.
     * Unbound metrics contribute nothing.
     *
     * @param expression the expression
     * @return entity names in first-seen order
     */
    public static Set<String> entities(MetricsExpression expression) {
        Set<String> entities = new LinkedHashSet<>();
        for (Timeseries timeseries : timeseries(expression)) {
            if (timeseries.metric().entity() != null) {
                entities.add(timeseries.metric().entity());
            }
        }
        return entities;
    }
}
