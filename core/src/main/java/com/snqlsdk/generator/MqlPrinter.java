package com.snqlsdk.generator;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.expression.AliasedExpression;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.BooleanOp;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.ScalarLiteral;
import com.snqlsdk.metrics.ArithmeticOperator;
import com.snqlsdk.metrics.Constant;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.FormulaParameter;
import com.snqlsdk.metrics.Metric;
import com.snqlsdk.metrics.MetricsExpression;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.optimizer.OrToInOptimizer;
import com.snqlsdk.validation.Identifiers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders metrics expressions as MQL.
 *
 * <pre>
 *   max(d:transactions/duration@millisecond){environment:"prod" AND !release:["1.0", "1.1"]} by (transaction)
 *   (sum(transaction.duration) / count(transaction.duration)) by (transaction)
 *   apdex(sum(transaction.duration), 500)
 * </pre>
 *
 * <p>Metric names print unquoted when the MQL grammar allows it and in backticks
 * otherwise. Tag values are double-quoted and escaped by {@link Escaping}; the
 * operator of a filter is encoded in its shape: {@code !} for negation, a list
 * for membership, a trailing {@code *} for a pattern.
 */
public final class MqlPrinter {

    private MqlPrinter() {} // Utility class

    /**
     * Renders a timeseries or formula.
     *
     * @param expression the expression
     * @return the MQL text
     */
    public static String toMql(MetricsExpression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        return translateParameter(expression);
    }

    /**
     * Validates a metrics query and renders it for the wire: the MQL text, with
     * OR groups of equalities merged into lists, plus the context the grammar
     * cannot carry.
     *
     * @param query the metrics query
     * @return {@code {"mql": text, "mql_context": map}}
     */
    public static Map<String, Object> serialize(MetricsQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        query.validate();
        MetricsQuery resolved = query.resolve();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("mql", toMql(OrToInOptimizer.optimize(resolved.query())));
        result.put("mql_context", MqlContextPrinter.toContext(resolved).toMap());
        return result;
    }

    /**
     * Renders a metrics query for reading, one section per line. Unset sections
     * are shown as such and nothing is validated.
     *
     * @param query the metrics query
     * @return the text
     */
    public static String print(MetricsQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        StringJoiner lines = new StringJoiner("\n");
        lines.add("MQL " + (query.query() != null ? toMql(query.query()) : "<unset>"));
        lines.add("START " + (query.start() != null ? query.start() : "<unset>"));
        lines.add("END " + (query.end() != null ? query.end() : "<unset>"));
        lines.add("ROLLUP " + (query.rollup() != null ? MqlContextPrinter.rollupMap(query.rollup()) : "<unset>"));
        lines.add("SCOPE " + (query.scope() != null ? MqlContextPrinter.scopeMap(query.scope()) : "<unset>"));
        if (query.limit() != null) {
            lines.add("LIMIT " + query.limit());
        }
        if (query.offset() != null) {
            lines.add("OFFSET " + query.offset());
        }
        if (query.extrapolate() != null) {
            lines.add("EXTRAPOLATE " + query.extrapolate());
        }
        if (!query.indexerMappings().isEmpty()) {
            lines.add("INDEXER_MAPPINGS " + query.indexerMappings());
        }
        return lines.toString();
    }

    // ==================== Expressions ====================

    private static String translateParameter(FormulaParameter parameter) {
        if (parameter instanceof Timeseries) {
            return translateTimeseries((Timeseries) parameter);
        } else if (parameter instanceof Formula) {
            return translateFormula((Formula) parameter);
        } else if (parameter instanceof Constant) {
            return translateScalar(((Constant) parameter).value());
        }
        throw new InvalidExpressionException(
            "Unsupported formula parameter: " + parameter.getClass().getSimpleName());
    }

    private static String translateTimeseries(Timeseries timeseries) {
        StringBuilder sb = new StringBuilder(timeseries.aggregate());
        if (!timeseries.aggregateParams().isEmpty()) {
            sb.append(translateParams(timeseries.aggregateParams()));
        }
        sb.append('(').append(metricName(timeseries.metric())).append(')');
        appendFiltersAndGroupby(sb, timeseries);
        return sb.toString();
    }

    private static String translateFormula(Formula formula) {
        StringBuilder sb = new StringBuilder();
        ArithmeticOperator operator = formula.operator();
        if (operator != null) {
            StringJoiner joiner = new StringJoiner(" " + operator.symbol() + " ", "(", ")");
            for (FormulaParameter parameter : formula.parameters()) {
                joiner.add(translateParameter(parameter));
            }
            sb.append(joiner);
        } else {
            sb.append(formula.function());
            if (!formula.aggregateParams().isEmpty()) {
                sb.append(translateParams(formula.aggregateParams()));
            }
            StringJoiner joiner = new StringJoiner(", ", "(", ")");
            for (FormulaParameter parameter : formula.parameters()) {
                joiner.add(translateParameter(parameter));
            }
            sb.append(joiner);
        }
        appendFiltersAndGroupby(sb, formula);
        return sb.toString();
    }

    private static void appendFiltersAndGroupby(StringBuilder sb, MetricsExpression expression) {
        if (!expression.filters().isEmpty()) {
            StringJoiner joiner = new StringJoiner(" AND ", "{", "}");
            for (Expression filter : expression.filters()) {
                joiner.add(translateFilter(filter, BooleanOp.AND));
            }
            sb.append(joiner);
        }
        if (!expression.groupby().isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ", " by (", ")");
            for (Expression column : expression.groupby()) {
                joiner.add(translateGroupby(column));
            }
            sb.append(joiner);
        }
    }

    private static String translateParams(List<ScalarLiteral> params) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (ScalarLiteral param : params) {
            joiner.add(translateScalar(param));
        }
        return joiner.toString();
    }

    /**
     * Returns the name of a metric as written in MQL, backticked when the bare
     * form would not parse.
     *
     * @param metric the metric
     * @return the name
     */
    public static String metricName(Metric metric) {
        String name = metric.mqlName();
        if (Identifiers.UNQUOTED_MRI.matcher(name).matches() || Identifiers.PUBLIC_NAME.matcher(name).matches()) {
            return name;
        }
        return "`" + name + "`";
    }

    // ==================== Filters ====================

    private static String translateFilter(Expression filter, BooleanOp parent) {
        if (filter instanceof BooleanCondition) {
            BooleanCondition group = (BooleanCondition) filter;
            StringJoiner joiner = new StringJoiner(" " + group.op().token() + " ");
            for (Expression member : group.conditions()) {
                joiner.add(translateFilter(member, group.op()));
            }
            return group.op() != parent ? "(" + joiner + ")" : joiner.toString();
        }
        if (filter instanceof Condition) {
            return translateCondition((Condition) filter);
        }
        throw new InvalidExpressionException(
            "MQL filters must be conditions, found " + filter.getClass().getSimpleName(), "Condition", "mql-filter");
    }

    private static String translateCondition(Condition condition) {
        if (!(condition.lhs() instanceof Column)) {
            throw new InvalidExpressionException(
                "MQL filters must have a tag column on the left, found " + condition.lhs(),
                "Condition", "mql-filter");
        }
        String tag = ((Column) condition.lhs()).name();
        Op op = condition.op();
        String value;
        switch (op) {
            case EQ:
            case NEQ:
                value = translateTagValue(condition.rhs());
                if (value.endsWith("*\"")) {
                    // A bare trailing star would read back as LIKE
                    value = value.substring(0, value.length() - 2) + "\\*\"";
                }
                break;
            case LIKE:
            case NOT_LIKE:
                value = translateTagValue(condition.rhs());
                break;
            case IN:
            case NOT_IN:
                value = translateTagList(condition.rhs());
                break;
            default:
                throw new InvalidExpressionException(
                    "operator " + op.token() + " cannot be expressed in MQL", "Condition", "mql-operator");
        }
        return (op.isNegated() ? "!" : "") + tag + ":" + value;
    }

    private static String translateTagValue(Expression rhs) {
        if (!(rhs instanceof ScalarLiteral) || ((ScalarLiteral) rhs).kind().isSequence()) {
            throw new InvalidExpressionException(
                "MQL tag values must be scalars, found " + rhs, "Condition", "mql-filter");
        }
        return translateScalar((ScalarLiteral) rhs);
    }

    private static String translateTagList(Expression rhs) {
        if (!(rhs instanceof ScalarLiteral) || !((ScalarLiteral) rhs).kind().isSequence()) {
            throw new InvalidExpressionException(
                "MQL membership filters need a list of values, found " + rhs, "Condition", "mql-filter");
        }
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (ScalarLiteral element : ((ScalarLiteral) rhs).elements()) {
            joiner.add(translateScalar(element));
        }
        return joiner.toString();
    }

    private static String translateGroupby(Expression column) {
        if (column instanceof Column) {
            return ((Column) column).name();
        }
        AliasedExpression aliased = (AliasedExpression) column;
        return aliased.expression().name() + " AS " + ExpressionTranslator.quoteAlias(aliased.alias());
    }

    private static String translateScalar(ScalarLiteral literal) {
        switch (literal.kind()) {
            case STRING:
                return Escaping.quote(literal.asString(), Escaping.DOUBLE_QUOTE);
            case INTEGER:
                return Long.toString(literal.asLong());
            case FLOAT:
                return ExpressionTranslator.formatFloat(literal.asDouble());
            case BOOLEAN:
                return literal.asBoolean() ? "true" : "false";
            default:
                throw new InvalidExpressionException(
                    "literal of kind " + literal.kind() + " cannot be expressed in MQL", "ScalarLiteral", "mql-literal");
        }
    }
}
