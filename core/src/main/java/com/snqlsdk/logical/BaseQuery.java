package com.snqlsdk.logical;

import java.util.Map;

/**
 * A query that can be sent in a {@link Request}: an event {@link Query}, a
 * {@link com.snqlsdk.metrics.MetricsQuery} or a {@link DeleteQuery}.
 */
public interface BaseQuery {

    /**
     * Runs every validation pass over the query.
     *
     * @throws com.snqlsdk.exception.SnqlException describing the first structural
     *         error, or all schema violations together
     */
    void validate();

    /**
     * Validates the query and renders it in its dialect.
     *
     * @return the canonical query text
     */
    String serialize();

    /**
     * Validates the query and renders it in a human-readable multi-line form.
     *
     * @return the readable query text
     */
    String print();

    /**
     * Returns the request body fields this query contributes: the {@code query}
     * field holding the serialized text, or {@code columns} for a delete.
     *
     * @return ordered field map
     */
    Map<String, Object> requestFields();
}
