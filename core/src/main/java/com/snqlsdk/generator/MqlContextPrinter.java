package com.snqlsdk.generator;

import com.snqlsdk.exception.InvalidQueryException;
import com.snqlsdk.metrics.MQLContext;
import com.snqlsdk.metrics.MetricsExpressions;
import com.snqlsdk.metrics.MetricsQuery;
import com.snqlsdk.metrics.MetricsScope;
import com.snqlsdk.metrics.Rollup;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the {@link MQLContext} of a metrics query.
 */
public final class MqlContextPrinter {

    private MqlContextPrinter() {} // Utility class

    /**
     * Builds the context of a metrics query. The entity is filled in when every
     * metric is bound to the same one.
     *
     * @param query a metrics query with start, end, rollup and scope set
     * @return the context
     * @throws InvalidQueryException if a mandatory field is unset
     */
    public static MQLContext toContext(MetricsQuery query) {
        if (query.start() == null) {
            throw new InvalidQueryException("MetricsQuery.start must be set", "MetricsQuery", "start");
        }
        if (query.end() == null) {
            throw new InvalidQueryException("MetricsQuery.end must be set", "MetricsQuery", "end");
        }
        if (query.rollup() == null) {
            throw new InvalidQueryException("MetricsQuery.rollup must be set", "MetricsQuery", "rollup");
        }
        if (query.scope() == null) {
            throw new InvalidQueryException("MetricsQuery.scope must be set", "MetricsQuery", "scope");
        }

        String entity = null;
        if (query.query() != null) {
            Set<String> entities = MetricsExpressions.entities(query.query());
            if (entities.size() == 1) {
                entity = entities.iterator().next();
            }
        }
        return new MQLContext(
            entity,
            query.start().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            query.end().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            rollupMap(query.rollup()),
            scopeMap(query.scope()),
            query.limit(),
            query.offset(),
            query.extrapolate(),
            query.indexerMappings());
    }

    /**
     * Returns the wire map of a rollup:
     * {@code {"orderby": "ASC"|"DESC"|null, "granularity", "interval", "with_totals": "True"|"False"|null}}.
     *
     * @param rollup the rollup
     * @return ordered map, null values included
     */
    public static Map<String, Object> rollupMap(Rollup rollup) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("orderby", rollup.orderby() != null ? rollup.orderby().name() : null);
        map.put("granularity", rollup.granularity());
        map.put("interval", rollup.interval());
        map.put("with_totals", rollup.totals() != null ? (rollup.totals() ? "True" : "False") : null);
        return map;
    }

    /**
     * Returns the wire map of a scope: {@code {"org_ids", "project_ids", "use_case_id"}}.
     *
     * @param scope the scope
     * @return ordered map
     */
    public static Map<String, Object> scopeMap(MetricsScope scope) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("org_ids", scope.orgIds());
        map.put("project_ids", scope.projectIds());
        map.put("use_case_id", scope.useCaseId());
        return map;
    }
}
