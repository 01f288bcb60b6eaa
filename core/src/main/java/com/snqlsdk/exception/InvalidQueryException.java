package com.snqlsdk.exception;

/**
 * Exception thrown when a query container (event query or metrics query) is
 * malformed, for example an empty select or totals without a group by.
 */
public class InvalidQueryException extends InvalidExpressionException {

    public InvalidQueryException(String message, String rule) {
        super(message, "Query", rule);
    }

    public InvalidQueryException(String message, String node, String rule) {
        super(message, node, rule);
    }
}
