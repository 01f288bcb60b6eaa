package com.snqlsdk.logical;

import com.snqlsdk.config.QueryLimits;
import com.snqlsdk.exception.InvalidQueryException;
import com.snqlsdk.expression.BooleanCondition;
import com.snqlsdk.expression.Column;
import com.snqlsdk.expression.Condition;
import com.snqlsdk.expression.Expression;
import com.snqlsdk.expression.LimitBy;
import com.snqlsdk.expression.OrderBy;
import com.snqlsdk.generator.EventQueryPrinter;
import com.snqlsdk.optimizer.OrToInOptimizer;
import com.snqlsdk.validation.SchemaValidator;
import com.snqlsdk.validation.StructuralValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An event-dialect query.
 *
 * <p>Queries are immutable. Every {@code set*} method returns a new query that
 * shares all untouched clauses with the original, so builder chains can be
 * forked freely:
 * <pre>
 *   Query base = new Query(new Entity("events"))
 *       .setSelect(Column.of("event_id"))
 *       .setWhere(List.of(Condition.of(Column.of("project_id"), Op.EQ, 1)));
 *   Query limited = base.setLimit(10);   // base is unchanged
 * </pre>
 *
 * <p>Setters only check the shape of their argument. The structural and schema
 * passes run when {@link #validate()}, {@link #serialize()} or {@link #print()}
 * is called, so a chain may pass through invalid intermediate states.
 */
public final class Query implements BaseQuery, MatchClause {

    private static final Logger logger = LoggerFactory.getLogger(Query.class);

    private final MatchClause match;
    private final List<Expression> select;
    private final List<Expression> groupby;
    private final List<Column> arrayJoin;
    private final List<Expression> where;
    private final List<Expression> having;
    private final List<OrderBy> orderby;
    private final LimitBy limitby;
    private final Integer limit;
    private final Integer offset;
    private final Integer granularity;
    private final boolean totals;

    /**
     * Creates an empty query reading from the given source.
     *
     * @param match an entity, a join, or an inner query
     */
    public Query(MatchClause match) {
        this(Objects.requireNonNull(match, "match must not be null"),
             List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
             null, null, null, null, false);
    }

    private Query(MatchClause match, List<Expression> select, List<Expression> groupby,
                  List<Column> arrayJoin, List<Expression> where, List<Expression> having,
                  List<OrderBy> orderby, LimitBy limitby, Integer limit, Integer offset,
                  Integer granularity, boolean totals) {
        this.match = match;
        this.select = select;
        this.groupby = groupby;
        this.arrayJoin = arrayJoin;
        this.where = where;
        this.having = having;
        this.orderby = orderby;
        this.limitby = limitby;
        this.limit = limit;
        this.offset = offset;
        this.granularity = granularity;
        this.totals = totals;
    }

    // ==================== Accessors ====================

    public MatchClause match() {
        return match;
    }

    public List<Expression> select() {
        return select;
    }

    public List<Expression> groupby() {
        return groupby;
    }

    public List<Column> arrayJoin() {
        return arrayJoin;
    }

    public List<Expression> where() {
        return where;
    }

    public List<Expression> having() {
        return having;
    }

    public List<OrderBy> orderby() {
        return orderby;
    }

    /**
     * @return the limit-by clause, or null if unset
     */
    public LimitBy limitby() {
        return limitby;
    }

    /**
     * @return the limit, or null if unset
     */
    public Integer limit() {
        return limit;
    }

    /**
     * @return the offset, or null if unset
     */
    public Integer offset() {
        return offset;
    }

    /**
     * @return the granularity in seconds, or null if unset
     */
    public Integer granularity() {
        return granularity;
    }

    public boolean totals() {
        return totals;
    }

    // ==================== Builders ====================

    public Query setMatch(MatchClause match) {
        Objects.requireNonNull(match, "match must not be null");
        return new Query(match, select, groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setSelect(List<? extends Expression> select) {
        Objects.requireNonNull(select, "select must not be null");
        if (select.isEmpty()) {
            throw new InvalidQueryException("select clause must contain at least one expression", "select");
        }
        return new Query(match, List.copyOf(select), groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setSelect(Expression... select) {
        return setSelect(Arrays.asList(select));
    }

    public Query setGroupby(List<? extends Expression> groupby) {
        Objects.requireNonNull(groupby, "groupby must not be null");
        return new Query(match, select, List.copyOf(groupby), arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setGroupby(Expression... groupby) {
        return setGroupby(Arrays.asList(groupby));
    }

    public Query setArrayJoin(List<Column> arrayJoin) {
        Objects.requireNonNull(arrayJoin, "arrayJoin must not be null");
        if (arrayJoin.isEmpty()) {
            throw new InvalidQueryException("array join must contain at least one column", "array-join");
        }
        return new Query(match, select, groupby, List.copyOf(arrayJoin), where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setWhere(List<? extends Expression> where) {
        return new Query(match, select, groupby, arrayJoin, checkConditions(where, "where"), having,
                         orderby, limitby, limit, offset, granularity, totals);
    }

    public Query setWhere(Expression... where) {
        return setWhere(Arrays.asList(where));
    }

    public Query setHaving(List<? extends Expression> having) {
        return new Query(match, select, groupby, arrayJoin, where, checkConditions(having, "having"),
                         orderby, limitby, limit, offset, granularity, totals);
    }

    public Query setHaving(Expression... having) {
        return setHaving(Arrays.asList(having));
    }

    public Query setOrderby(List<OrderBy> orderby) {
        Objects.requireNonNull(orderby, "orderby must not be null");
        return new Query(match, select, groupby, arrayJoin, where, having, List.copyOf(orderby),
                         limitby, limit, offset, granularity, totals);
    }

    public Query setOrderby(OrderBy... orderby) {
        return setOrderby(Arrays.asList(orderby));
    }

    public Query setLimitby(LimitBy limitby) {
        Objects.requireNonNull(limitby, "limitby must not be null");
        return new Query(match, select, groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setLimit(int limit) {
        checkLimit(limit);
        return new Query(match, select, groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setOffset(int offset) {
        checkOffset(offset);
        return new Query(match, select, groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setGranularity(int granularity) {
        checkGranularity(granularity);
        return new Query(match, select, groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    public Query setTotals(boolean totals) {
        return new Query(match, select, groupby, arrayJoin, where, having, orderby,
                         limitby, limit, offset, granularity, totals);
    }

    private static List<Expression> checkConditions(List<? extends Expression> conditions, String clause) {
        Objects.requireNonNull(conditions, clause + " must not be null");
        for (Expression condition : conditions) {
            if (!(condition instanceof Condition) && !(condition instanceof BooleanCondition)) {
                throw new InvalidQueryException(
                    clause + " clause must be a list of conditions, found " + condition, clause);
            }
        }
        return List.copyOf(conditions);
    }

    /**
     * Checks a limit value against the allowed range.
     *
     * @param limit the limit
     */
    public static void checkLimit(int limit) {
        if (limit < QueryLimits.MIN_LIMIT || limit > QueryLimits.MAX_LIMIT) {
            throw new InvalidQueryException(
                "limit '" + limit + "' must be between " + QueryLimits.MIN_LIMIT +
                " and " + QueryLimits.MAX_LIMIT, "limit");
        }
    }

    public static void checkOffset(int offset) {
        if (offset < 0) {
            throw new InvalidQueryException("offset '" + offset + "' must be at least 0", "offset");
        }
    }

    public static void checkGranularity(int granularity) {
        if (granularity < 1) {
            throw new InvalidQueryException(
                "granularity '" + granularity + "' must be at least 1", "granularity");
        }
    }

    // ==================== Validation and rendering ====================

    @Override
    public void validate() {
        StructuralValidator.validate(this);
        SchemaValidator.validate(this);
    }

    @Override
    public String serialize() {
        validate();
        String text = EventQueryPrinter.serialize(OrToInOptimizer.optimize(this));
        logger.debug("Serialized query: {}", text);
        return text;
    }

    @Override
    public String print() {
        validate();
        return EventQueryPrinter.print(this);
    }

    @Override
    public Map<String, Object> requestFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("query", serialize());
        return fields;
    }

    @Override
    public String toString() {
        return EventQueryPrinter.print(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Query)) return false;
        Query that = (Query) obj;
        return totals == that.totals &&
               match.equals(that.match) &&
               select.equals(that.select) &&
               groupby.equals(that.groupby) &&
               arrayJoin.equals(that.arrayJoin) &&
               where.equals(that.where) &&
               having.equals(that.having) &&
               orderby.equals(that.orderby) &&
               Objects.equals(limitby, that.limitby) &&
               Objects.equals(limit, that.limit) &&
               Objects.equals(offset, that.offset) &&
               Objects.equals(granularity, that.granularity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(match, select, groupby, arrayJoin, where, having, orderby,
                            limitby, limit, offset, granularity, totals);
    }
}
