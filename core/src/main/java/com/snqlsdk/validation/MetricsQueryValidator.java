package com.snqlsdk.validation;

import com.snqlsdk.exception.InvalidQueryException;
import com.snqlsdk.logical.Query;
import com.snqlsdk.metrics.MetricsQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates the fields of a {@link MetricsQuery}: a query, a time window with
 * {@code start < end}, a rollup with a resolved granularity, a scope, and limit
 * and offset within range. The timeseries or formula is then checked by the
 * {@link StructuralValidator}.
 */
public final class MetricsQueryValidator {

    private static final Logger logger = LoggerFactory.getLogger(MetricsQueryValidator.class);

    private static final String NODE = "MetricsQuery";

    private MetricsQueryValidator() {} // Utility class

    /**
     * Validates a metrics query.
     *
     * @param query the query, with its rollup already resolved
     * @throws InvalidQueryException on the first missing or invalid field
     */
    public static void validate(MetricsQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        if (query.query() == null) {
            throw new InvalidQueryException("query is required for a metrics query", NODE, "query");
        }
        if (query.start() == null) {
            throw new InvalidQueryException("start is required for a metrics query", NODE, "start");
        }
        if (query.end() == null) {
            throw new InvalidQueryException("end is required for a metrics query", NODE, "end");
        }
        if (!query.start().isBefore(query.end())) {
            throw new InvalidQueryException(
                "start " + query.start() + " must be before end " + query.end(), NODE, "time-range");
        }
        if (query.rollup() == null) {
            throw new InvalidQueryException("rollup is required for a metrics query", NODE, "rollup");
        }
        if (query.rollup().granularity() == null) {
            throw new InvalidQueryException("granularity must be set on the rollup", NODE, "granularity");
        }
        if (query.scope() == null) {
            throw new InvalidQueryException("scope is required for a metrics query", NODE, "scope");
        }
        if (query.limit() != null) {
            Query.checkLimit(query.limit());
        }
        if (query.offset() != null) {
            Query.checkOffset(query.offset());
        }

        StructuralValidator.validate(query.query());
        logger.debug("Metrics query passed validation");
    }
}
