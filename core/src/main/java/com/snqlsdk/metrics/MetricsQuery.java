package com.snqlsdk.metrics;

import com.snqlsdk.config.QueryLimits;
import com.snqlsdk.exception.InvalidQueryException;
import com.snqlsdk.generator.MqlPrinter;
import com.snqlsdk.logical.BaseQuery;
import com.snqlsdk.logical.Query;
import com.snqlsdk.optimizer.OrToInOptimizer;
import com.snqlsdk.schema.EntityModel;
import com.snqlsdk.validation.MetricsQueryValidator;
import com.snqlsdk.validation.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A query over one or more metrics timeseries.
 *
 * <p>The query itself is a {@link Timeseries} or {@link Formula} rendered as MQL;
 * everything the MQL grammar cannot carry (time window, rollup, tenant scope,
 * paging and indexer mappings) travels next to it as the {@link MQLContext}.
 *
 * <p>Like {@link Query}, a metrics query is immutable and built incrementally:
 * <pre>
 *   MetricsQuery query = new MetricsQuery()
 *       .setQuery(new Timeseries(Metric.ofPublicName("transaction.duration"), "max"))
 *       .setStart(LocalDateTime.of(2023, 1, 1, 0, 0))
 *       .setEnd(LocalDateTime.of(2023, 1, 2, 0, 0))
 *       .setRollup(Rollup.ofInterval(3600))
 *       .setScope(new MetricsScope(List.of(1L), List.of(11L), "transactions"));
 * </pre>
 * Nothing is validated until {@link #validate()}, {@link #serialize()} or
 * {@link #print()} runs. Start and end are naive timestamps in UTC.
 */
public final class MetricsQuery implements BaseQuery {

    private static final Logger logger = LoggerFactory.getLogger(MetricsQuery.class);

    private final MetricsExpression query;
    private final LocalDateTime start;
    private final LocalDateTime end;
    private final Rollup rollup;
    private final MetricsScope scope;
    private final Integer limit;
    private final Integer offset;
    private final Boolean extrapolate;
    private final Map<String, Object> indexerMappings;

    public MetricsQuery() {
        this(null, null, null, null, null, null, null, null, Map.of());
    }

    private MetricsQuery(MetricsExpression query, LocalDateTime start, LocalDateTime end,
                         Rollup rollup, MetricsScope scope, Integer limit, Integer offset,
                         Boolean extrapolate, Map<String, Object> indexerMappings) {
        this.query = query;
        this.start = start;
        this.end = end;
        this.rollup = rollup;
        this.scope = scope;
        this.limit = limit;
        this.offset = offset;
        this.extrapolate = extrapolate;
        this.indexerMappings = indexerMappings;
    }

    // ==================== Accessors ====================

    /**
     * @return the timeseries or formula, or null if unset
     */
    public MetricsExpression query() {
        return query;
    }

    public LocalDateTime start() {
        return start;
    }

    public LocalDateTime end() {
        return end;
    }

    public Rollup rollup() {
        return rollup;
    }

    public MetricsScope scope() {
        return scope;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    /**
     * @return whether the engine should extrapolate sampled data, or null if unset
     */
    public Boolean extrapolate() {
        return extrapolate;
    }

    /**
     * Returns the string-to-id mappings for metric names and tag values used in
     * the query. Values are {@link String}s or {@link Long}s.
     *
     * @return unmodifiable mapping, possibly empty
     */
    public Map<String, Object> indexerMappings() {
        return indexerMappings;
    }

    // ==================== Builders ====================

    public MetricsQuery setQuery(MetricsExpression query) {
        Objects.requireNonNull(query, "query must not be null");
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setStart(LocalDateTime start) {
        Objects.requireNonNull(start, "start must not be null");
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setEnd(LocalDateTime end) {
        Objects.requireNonNull(end, "end must not be null");
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setRollup(Rollup rollup) {
        Objects.requireNonNull(rollup, "rollup must not be null");
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setScope(MetricsScope scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setLimit(int limit) {
        Query.checkLimit(limit);
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setOffset(int offset) {
        Query.checkOffset(offset);
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setExtrapolate(boolean extrapolate) {
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    public MetricsQuery setIndexerMappings(Map<String, ?> indexerMappings) {
        Objects.requireNonNull(indexerMappings, "indexerMappings must not be null");
        Map<String, Object> mappings = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : indexerMappings.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Integer) {
                value = ((Integer) value).longValue();
            }
            if (!(value instanceof String) && !(value instanceof Long)) {
                throw new InvalidQueryException(
                    "indexer mapping for '" + entry.getKey() + "' must be a string or an integer",
                    "MetricsQuery", "indexer-mappings");
            }
            mappings.put(entry.getKey(), value);
        }
        return new MetricsQuery(query, start, end, rollup, scope, limit, offset, extrapolate,
                                Collections.unmodifiableMap(mappings));
    }

    // ==================== Resolution ====================

    /**
     * Returns this query with the rollup granularity filled in. Interval rollups
     * infer it on construction; totals rollups infer it here from the window.
     * The query is returned unchanged when there is nothing to infer or the
     * window is not yet known.
     *
     * @return the resolved query
     */
    public MetricsQuery resolve() {
        if (rollup == null || rollup.granularity() != null || start == null || end == null
                || !start.isBefore(end)) {
            return this;
        }
        long window = Duration.between(start, end).getSeconds();
        int granularity = QueryLimits.inferGranularityForWindow(window);
        logger.debug("Inferred granularity {} for a {}s totals window", granularity, window);
        return new MetricsQuery(query, start, end, rollup.withGranularity(granularity), scope,
                                limit, offset, extrapolate, indexerMappings);
    }

    // ==================== Validation and rendering ====================

    @Override
    public void validate() {
        MetricsQueryValidator.validate(resolve());
    }

    /**
     * Validates the query, then checks every metric and tag column against the
     * data models of the entities the metrics are bound to.
     *
     * @param models entity name to data model
     */
    public void validate(Map<String, EntityModel> models) {
        validate();
        SchemaValidator.validate(this, models);
    }

    @Override
    public String serialize() {
        validate();
        String mql = MqlPrinter.toMql(OrToInOptimizer.optimize(query));
        logger.debug("Serialized metrics query: {}", mql);
        return mql;
    }

    @Override
    public String print() {
        validate();
        return MqlPrinter.print(resolve());
    }

    @Override
    public Map<String, Object> requestFields() {
        Map<String, Object> wire = MqlPrinter.serialize(this);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("query", wire.get("mql"));
        fields.put("mql_context", wire.get("mql_context"));
        return fields;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MetricsQuery)) return false;
        MetricsQuery that = (MetricsQuery) obj;
        return Objects.equals(query, that.query) &&
               Objects.equals(start, that.start) &&
               Objects.equals(end, that.end) &&
               Objects.equals(rollup, that.rollup) &&
               Objects.equals(scope, that.scope) &&
               Objects.equals(limit, that.limit) &&
               Objects.equals(offset, that.offset) &&
               Objects.equals(extrapolate, that.extrapolate) &&
               indexerMappings.equals(that.indexerMappings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    @Override
    public String toString() {
        return MqlPrinter.print(this);
    }
}
