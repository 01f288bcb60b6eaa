package com.snqlsdk.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snqlsdk.exception.InvalidRequestException;
import com.snqlsdk.expression.Direction;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The part of a metrics query that MQL text cannot express: time window,
 * rollup, scope, paging, extrapolation, indexer mappings and optionally the
 * entity all metrics are read from.
 *
 * <p>Sent next to the MQL string as {@code mql_context}:
 * <pre>
 * {
 *   "start": "2023-01-02T03:04:05",
 *   "end": "2023-01-16T03:04:05",
 *   "rollup": {"orderby": null, "granularity": 3600, "interval": 3600, "with_totals": null},
 *   "scope": {"org_ids": [1], "project_ids": [11], "use_case_id": "transactions"},
 *   "limit": null,
 *   "offset": null,
 *   "extrapolate": null,
 *   "indexer_mappings": {}
 * }
 * </pre>
 * A context is normally produced from a valid {@link MetricsQuery}, so only the
 * presence of the mandatory sections is checked here.
 */
public final class MQLContext {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String entity;
    private final String start;
    private final String end;
    private final Map<String, Object> rollup;
    private final Map<String, Object> scope;
    private final Integer limit;
    private final Integer offset;
    private final Boolean extrapolate;
    private final Map<String, Object> indexerMappings;

    public MQLContext(String entity, String start, String end,
                      Map<String, ?> rollup, Map<String, ?> scope,
                      Integer limit, Integer offset, Boolean extrapolate,
                      Map<String, ?> indexerMappings) {
        this.entity = entity;
        this.start = required(start, "start");
        this.end = required(end, "end");
        this.rollup = copy(required(rollup, "rollup"));
        this.scope = copy(required(scope, "scope"));
        this.limit = limit;
        this.offset = offset;
        this.extrapolate = extrapolate;
        this.indexerMappings = copy(required(indexerMappings, "indexer_mappings"));
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new InvalidRequestException("MQLContext." + field + " is required", "mql_context." + field);
        }
        return value;
    }

    private static Map<String, Object> copy(Map<String, ?> values) {
        // LinkedHashMap rather than Map.copyOf: null values are part of the wire format
        return Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    }

    // ==================== Accessors ====================

    /**
     * @return the entity every metric is bound to, or null
     */
    public String entity() {
        return entity;
    }

    public String start() {
        return start;
    }

    public String end() {
        return end;
    }

    public Map<String, Object> rollup() {
        return rollup;
    }

    public Map<String, Object> scope() {
        return scope;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    public Boolean extrapolate() {
        return extrapolate;
    }

    public Map<String, Object> indexerMappings() {
        return indexerMappings;
    }

    // ==================== Typed views ====================

    public LocalDateTime startTime() {
        return parseTime(start, "start");
    }

    public LocalDateTime endTime() {
        return parseTime(end, "end");
    }

    private static LocalDateTime parseTime(String value, String field) {
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(
                "MQLContext." + field + " '" + value + "' is not an ISO datetime", "mql_context." + field, e);
        }
    }

    /**
     * Rebuilds the rollup from its wire map.
     *
     * @return the rollup
     */
    public Rollup toRollup() {
        Integer interval = toInteger(rollup.get("interval"), "rollup.interval");
        Integer granularity = toInteger(rollup.get("granularity"), "rollup.granularity");
        Boolean totals = toBoolean(rollup.get("with_totals"), "rollup.with_totals");
        Object orderby = rollup.get("orderby");
        Direction direction = orderby != null ? Direction.parse(orderby.toString()) : null;
        return new Rollup(interval, totals, direction, granularity);
    }

    /**
     * Rebuilds the scope from its wire map.
     *
     * @return the scope
     */
    public MetricsScope toScope() {
        List<Long> orgIds = toIdList(scope.get("org_ids"), "scope.org_ids");
        List<Long> projectIds = toIdList(scope.get("project_ids"), "scope.project_ids");
        Object useCaseId = scope.get("use_case_id");
        return new MetricsScope(orgIds, projectIds, useCaseId != null ? useCaseId.toString() : null);
    }

    private static Integer toInteger(Object value, String field) {
        if (value == null || "".equals(value)) {
            return null;
        }
        try {
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).intValueExact();
            }
            return Integer.valueOf(value.toString());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidRequestException(field + " must be an integer", "mql_context." + field, e);
        }
    }

    private static Boolean toBoolean(Object value, String field) {
        if (value == null || "".equals(value)) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString();
        if ("True".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("False".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        throw new InvalidRequestException(field + " must be a boolean", "mql_context." + field);
    }

    private static List<Long> toIdList(Object value, String field) {
        if (!(value instanceof List)) {
            throw new InvalidRequestException(field + " must be a list of integers", "mql_context." + field);
        }
        List<Long> ids = new ArrayList<>();
        for (Object id : (List<?>) value) {
            if (!(id instanceof Number)) {
                throw new InvalidRequestException(field + " must be a list of integers", "mql_context." + field);
            }
            try {
                ids.add(new BigDecimal(id.toString()).longValueExact());
            } catch (NumberFormatException | ArithmeticException e) {
                throw new InvalidRequestException(field + " must be a list of integers", "mql_context." + field, e);
            }
        }
        return ids;
    }

    // ==================== Wire format ====================

    /**
     * Returns the wire map. {@code entity} is included only when set.
     *
     * @return ordered map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (entity != null) {
            map.put("entity", entity);
        }
        map.put("start", start);
        map.put("end", end);
        map.put("rollup", rollup);
        map.put("scope", scope);
        map.put("limit", limit);
        map.put("offset", offset);
        map.put("extrapolate", extrapolate);
        map.put("indexer_mappings", indexerMappings);
        return map;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(toMap());
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Failed to serialize MQL context: " + e.getMessage(), "mql_context", e);
        }
    }

    /**
     * Builds a context from its wire map.
     *
     * @param map the decoded {@code mql_context} object
     * @return the context
     * @throws InvalidRequestException if a mandatory section is missing or mistyped
     */
    @SuppressWarnings("unchecked")
    public static MQLContext fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "map must not be null");
        return new MQLContext(
            asString(map.get("entity"), "entity"),
            asString(map.get("start"), "start"),
            asString(map.get("end"), "end"),
            (Map<String, ?>) asMap(map.get("rollup"), "rollup"),
            (Map<String, ?>) asMap(map.get("scope"), "scope"),
            toInteger(map.get("limit"), "limit"),
            toInteger(map.get("offset"), "offset"),
            toBoolean(map.get("extrapolate"), "extrapolate"),
            (Map<String, ?>) asMap(map.get("indexer_mappings"), "indexer_mappings"));
    }

    /**
     * Parses a context from JSON.
     *
     * @param json the {@code mql_context} JSON object
     * @return the context
     */
    public static MQLContext fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            Map<String, Object> map = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            return fromMap(map);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Invalid MQL context JSON: " + e.getOriginalMessage(), "mql_context", e);
        }
    }

    private static String asString(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new InvalidRequestException("MQLContext." + field + " must be a string", "mql_context." + field);
        }
        return (String) value;
    }

    private static Map<?, ?> asMap(Object value, String field) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new InvalidRequestException("MQLContext." + field + " must be an object", "mql_context." + field);
        }
        return (Map<?, ?>) value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MQLContext)) return false;
        MQLContext that = (MQLContext) obj;
        return Objects.equals(entity, that.entity) &&
               start.equals(that.start) &&
               end.equals(that.end) &&
               rollup.equals(that.rollup) &&
               scope.equals(that.scope) &&
               Objects.equals(limit, that.limit) &&
               Objects.equals(offset, that.offset) &&
               Objects.equals(extrapolate, that.extrapolate) &&
               indexerMappings.equals(that.indexerMappings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, start, end, rollup, scope, limit, offset, extrapolate, indexerMappings);
    }

    @Override
    public String toString() {
        return "MQLContext" + toMap();
    }
}
