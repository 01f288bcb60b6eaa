package com.snqlsdk.validation;

import com.snqlsdk.exception.SchemaValidationException;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.ExpressionUtils;
import com.snqlsdk.expression.Op;
import com.snqlsdk.expression.OrderBy;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.logical.Join;
import com.snqlsdk.logical.MatchClause;
import com.snqlsdk.logical.Query;
import com.snqlsdk.logical.Storage;
import com.snqlsdk.metrics.Formula;
import com.snqlsdk.metrics.FormulaParameter;
import com.snqlsdk.metrics.MetricsExpression;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.Timeseries;
import com.snqlsdk.schema.ColumnModel;
import com.snqlsdk.schema.EntityModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates queries against the data models of the entities they read.
 *
 * <p>For every entity carrying an {@link EntityModel}:
 * <ul>
 *   <li>every referenced column must exist in the model</li>
 *   <li>every required column must be filtered with {@code =} or {@code IN}</li>
 *   <li>the time column must be bounded with both {@code >=} and {@code <}</li>
 * </ul>
 * Only conditions that always apply count towards the requirements: elements of
 * the where list and of nested {@code AND} groups. A condition inside an
 * {@code OR} group does not.
 *
 * <p>Join queries additionally require every column to be qualified by an
 * entity of the join. A query reading from an inner query may only reference
 * what the inner query selects.
 *
 * <p>All violations of one pass are collected and thrown together as a
 * {@link SchemaValidationException}. Entities without a data model are not
 * checked.
 */
public final class SchemaValidator {

    private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);

    private SchemaValidator() {} // Utility class

    // ==================== Event queries ====================

    /**
     * Validates an event query, and recursively its inner query.
     *
     * @param query the query
     * @throws SchemaValidationException listing every violation found
     */
    public static void validate(Query query) {
        Objects.requireNonNull(query, "query must not be null");

        MatchClause match = query.match();
        List<String> violations = new ArrayList<>();
        String entityName = null;

        if (match instanceof Entity) {
            Entity entity = (Entity) match;
            entityName = entity.name();
            if (entity.dataModel() != null) {
                Set<Column> columns = referencedColumns(query);
                checkEntity(query, entity.dataModel(), null, columns, violations);
            }
        } else if (match instanceof Storage) {
            Storage storage = (Storage) match;
            entityName = storage.name();
            if (storage.dataModel() != null) {
                checkEntity(query, storage.dataModel(), null, referencedColumns(query), violations);
            }
        } else if (match instanceof Join) {
            checkJoin(query, (Join) match, violations);
        } else if (match instanceof Query) {
            Query inner = (Query) match;
            validate(inner);
            checkSubquery(query, inner, violations);
        }

        if (!violations.isEmpty()) {
            logger.debug("Schema validation found {} violation(s)", violations.size());
            throw new SchemaValidationException(entityName, violations);
        }
    }

    private static void checkJoin(Query query, Join join, List<String> violations) {
        Set<Column> columns = referencedColumns(query);
        for (Column column : columns) {
            if (column.entity() == null) {
                violations.add("column '" + column.name() + "' must be qualified by an entity of the join");
                continue;
            }
            Entity joined = join.entity(column.entity().alias());
            if (joined == null) {
                violations.add("column '" + column.name() + "' refers to unknown entity alias '" +
                               column.entity().alias() + "'");
            } else if (!joined.name().equals(column.entity().name())) {
                violations.add("column '" + column.name() + "' refers to alias '" + joined.alias() +
                               "' with entity '" + column.entity().name() + "', but the join binds it to '" +
                               joined.name() + "'");
            }
        }
        for (Entity entity : join.entities()) {
            if (entity.dataModel() != null) {
                checkEntity(query, entity.dataModel(), entity.alias(), columnsOf(columns, entity), violations);
            }
        }
    }

    private static Set<Column> columnsOf(Set<Column> columns, Entity entity) {
        Set<Column> result = new LinkedHashSet<>();
        for (Column column : columns) {
            if (column.entity() != null && entity.alias().equals(column.entity().alias())) {
                result.add(column);
            }
        }
        return result;
    }

    private static void checkSubquery(Query outer, Query inner, List<String> violations) {
        Set<String> available = new HashSet<>();
        for (Expression expression : inner.select()) {
            String name = ExpressionUtils.outputName(expression);
            if (name != null) {
                available.add(name);
            }
        }
        for (Column column : referencedColumns(outer)) {
            if (!available.contains(column.name())) {
                violations.add("column '" + column.name() + "' is not selected by the inner query");
            }
        }
    }

    // A non-null alias restricts conditions to columns qualified by that join alias
    private static void checkEntity(Query query, EntityModel model, String alias, Set<Column> columns,
                                    List<String> violations) {
        for (Column column : columns) {
            if (!model.contains(column.baseName())) {
                violations.add("entity '" + model.name() + "' does not support the column '" + column.name() + "'");
            }
        }

        List<Expression> conditions = ExpressionUtils.topLevelConditions(query.where());

        List<String> missing = new ArrayList<>();
        for (ColumnModel required : model.requiredColumns()) {
            if (!hasCondition(conditions, required.name(), alias, Op.EQ, Op.IN)) {
                missing.add("'" + required.name() + "'");
            }
        }
        if (!missing.isEmpty()) {
            violations.add("where clause is missing required condition(s) on column(s) " +
                           String.join(", ", missing) + qualifier(alias));
        }

        String time = model.requiredTimeColumn().name();
        List<String> missingOps = new ArrayList<>();
        if (!hasCondition(conditions, time, alias, Op.GTE)) {
            missingOps.add("'" + Op.GTE.token() + "'");
        }
        if (!hasCondition(conditions, time, alias, Op.LT)) {
            missingOps.add("'" + Op.LT.token() + "'");
        }
        if (!missingOps.isEmpty()) {
            violations.add("where clause is missing condition(s) on time column '" + time +
                           "' with operator(s) " + String.join(", ", missingOps) + qualifier(alias));
        }
    }

    private static String qualifier(String alias) {
        return alias != null ? " for entity alias '" + alias + "'" : "";
    }

    private static boolean hasCondition(List<Expression> conditions, String columnName, String alias,
                                        Op... ops) {
        for (Expression expression : conditions) {
            if (!(expression instanceof Condition)) {
                continue;
            }
            Condition condition = (Condition) expression;
            if (!(condition.lhs() instanceof Column)) {
                continue;
            }
            Column column = (Column) condition.lhs();
            if (!column.name().equals(columnName)) {
                continue;
            }
            if (alias != null && (column.entity() == null || !alias.equals(column.entity().alias()))) {
                continue;
            }
            for (Op op : ops) {
                if (condition.op() == op) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns every column a query references, excluding references to aliases
     * defined in its own select.
     */
    private static Set<Column> referencedColumns(Query query) {
        List<Expression> expressions = new ArrayList<>();
        expressions.addAll(query.select());
        expressions.addAll(query.groupby());
        expressions.addAll(query.arrayJoin());
        expressions.addAll(query.where());
        expressions.addAll(query.having());
        for (OrderBy orderBy : query.orderby()) {
            expressions.add(orderBy.expression());
        }
        if (query.limitby() != null) {
            expressions.addAll(query.limitby().columns());
        }

        Set<String> aliases = new HashSet<>();
        for (Expression expression : query.select()) {
            String name = ExpressionUtils.outputName(expression);
            if (name != null && !(expression instanceof Column)) {
                aliases.add(name);
            }
        }

        Set<Column> columns = new LinkedHashSet<>();
        for (Column column : ExpressionUtils.findColumns(expressions)) {
            if (column.entity() == null && aliases.contains(column.name())) {
                continue;
            }
            columns.add(column);
        }
        return columns;
    }

    // ==================== Metrics queries ====================

    /**
     * Validates the metrics of a metrics query against entity data models: every
     * metric must be bound to an entity with a model, and every tag it is
     * filtered or grouped by must exist in that model.
     *
     * @param query the metrics query
     * @param models entity name to data model
     * @throws SchemaValidationException listing every violation found
     */
    public static void validate(MetricsQuery query, Map<String, EntityModel> models) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(models, "models must not be null");
        if (query.query() == null) {
            return;
        }

        List<String> violations = new ArrayList<>();
        checkMetrics(query.query(), List.of(), models, violations);
        if (!violations.isEmpty()) {
            logger.debug("Metrics schema validation found {} violation(s)", violations.size());
            throw new SchemaValidationException(null, violations);
        }
    }

    private static void checkMetrics(FormulaParameter parameter, List<Expression> inherited,
                                     Map<String, EntityModel> models, List<String> violations) {
        if (!(parameter instanceof MetricsExpression)) {
            return;
        }
        MetricsExpression expression = (MetricsExpression) parameter;
        List<Expression> clauses = new ArrayList<>(inherited);
        clauses.addAll(expression.filters());
        clauses.addAll(expression.groupby());

        if (expression instanceof Formula) {
            for (FormulaParameter child : ((Formula) expression).parameters()) {
                checkMetrics(child, clauses, models, violations);
            }
            return;
        }

        Timeseries timeseries = (Timeseries) expression;
        String entity = timeseries.metric().entity();
        if (entity == null) {
            violations.add("metric '" + timeseries.metric().mqlName() + "' is not bound to an entity");
            return;
        }
        EntityModel model = models.get(entity);
        if (model == null) {
            violations.add("no data model for entity '" + entity + "' of metric '" +
                           timeseries.metric().mqlName() + "'");
            return;
        }
        for (Column column : ExpressionUtils.findColumns(clauses)) {
            if (!model.contains(column.baseName())) {
                violations.add("entity '" + entity + "' does not support the tag '" + column.name() + "'");
            }
        }
    }
}
