package com.snqlsdk.config;

import java.util.List;

/**
 * Configuration constants bounding query construction and parsing.
 */
public final class QueryLimits {

    private QueryLimits() {} // Utility class

    /** Smallest accepted LIMIT */
    public static final int MIN_LIMIT = 1;

    /** Largest accepted LIMIT, also the cap for LIMIT BY counts */
    public static final int MAX_LIMIT = 10000;

    /** Largest accepted LIMIT BY count */
    public static final int MAX_LIMIT_BY = 10000;

    /** Nesting bound for the MQL parser (parentheses, function calls, filter groups) */
    public static final int MAX_PARSE_DEPTH = 64;

    /** Minimum rollup interval in seconds */
    public static final int MIN_INTERVAL = 10;

    /** Storage granularities a metrics rollup may read from, in seconds, ascending */
    public static final List<Integer> ALLOWED_GRANULARITIES = List.of(10, 60, 3600, 86400);

    /** Parent API reported when the caller does not name one */
    public static final String DEFAULT_PARENT_API = "<unknown>";

    /**
     * Checks that a value is one of the allowed storage granularities.
     *
     * @param granularity granularity in seconds
     * @return true if allowed
     */
    public static boolean isAllowedGranularity(int granularity) {
        return ALLOWED_GRANULARITIES.contains(granularity);
    }

    /**
     * Infers the coarsest allowed granularity that evenly divides an interval.
     *
     * @param intervalSeconds rollup interval, at least {@link #MIN_INTERVAL}
     * @return inferred granularity in seconds
     */
    public static int inferGranularity(int intervalSeconds) {
        for (int i = ALLOWED_GRANULARITIES.size() - 1; i >= 0; i--) {
            int candidate = ALLOWED_GRANULARITIES.get(i);
            if (candidate <= intervalSeconds && intervalSeconds % candidate == 0) {
                return candidate;
            }
        }
        return ALLOWED_GRANULARITIES.get(0);
    }

    /**
     * Infers the granularity for a totals query from the length of its window:
     * the coarsest allowed granularity that fits into the window at least once.
     *
     * @param windowSeconds query window length in seconds
     * @return inferred granularity in seconds
     */
    public static int inferGranularityForWindow(long windowSeconds) {
        for (int i = ALLOWED_GRANULARITIES.size() - 1; i >= 0; i--) {
            int candidate = ALLOWED_GRANULARITIES.get(i);
            if (candidate <= windowSeconds) {
                return candidate;
            }
        }
        return ALLOWED_GRANULARITIES.get(0);
    }
}
