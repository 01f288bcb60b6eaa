package com.snqlsdk.metrics;

import com.snqlsdk.config.QueryLimits;
import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.expression.Direction;

import java.util.Objects;

/**
 * How a metrics query groups on time.
 *
 * <p>A timeseries query sets {@code interval}, the bucket width in seconds. A
 * totals query sets {@code totals} to true instead, and may be ordered by its
 * aggregate value. Exactly one of the two is set.
 *
 * <p>{@code granularity} picks the storage resolution the data is read from. When
 * omitted on an interval rollup it is inferred as the coarsest allowed granularity
 * that divides the interval; on a totals rollup it is inferred from the query
 * window by {@link MetricsQuery}.
 */
public final class Rollup {

    private final Integer interval;
    private final Boolean totals;
    private final Direction orderby;
    private final Integer granularity;

    public Rollup(Integer interval, Boolean totals, Direction orderby, Integer granularity) {
        boolean hasTotals = Boolean.TRUE.equals(totals);
        if (interval == null && !hasTotals) {
            throw new InvalidExpressionException(
                "Rollup must have at least one of interval or totals", "Rollup", "rollup-mode");
        }
        if (interval != null && hasTotals) {
            throw new InvalidExpressionException(
                "Rollup can have only one of interval or totals", "Rollup", "rollup-mode");
        }
        if (granularity != null && !QueryLimits.isAllowedGranularity(granularity)) {
            throw new InvalidExpressionException(
                "granularity must be one of " + QueryLimits.ALLOWED_GRANULARITIES, "Rollup", "granularity");
        }
        if (interval != null) {
            if (interval < QueryLimits.MIN_INTERVAL) {
                throw new InvalidExpressionException(
                    "interval '" + interval + "' must be at least " + QueryLimits.MIN_INTERVAL,
                    "Rollup", "interval");
            }
            if (granularity != null && interval < granularity) {
                throw new InvalidExpressionException(
                    "interval must be greater than or equal to granularity", "Rollup", "interval");
            }
            if (orderby != null) {
                throw new InvalidExpressionException(
                    "Timeseries queries can't be ordered when using interval", "Rollup", "rollup-orderby");
            }
        }
        this.interval = interval;
        this.totals = totals;
        this.orderby = orderby;
        this.granularity = granularity != null || interval == null
            ? granularity
            : Integer.valueOf(QueryLimits.inferGranularity(interval));
    }

    /**
     * @return bucket width in seconds, or null for a totals rollup
     */
    public Integer interval() {
        return interval;
    }

    /**
     * @return the totals flag, or null if unset
     */
    public Boolean totals() {
        return totals;
    }

    public boolean isTotals() {
        return Boolean.TRUE.equals(totals);
    }

    /**
     * @return ordering of a totals query by its aggregate, or null
     */
    public Direction orderby() {
        return orderby;
    }

    /**
     * @return storage granularity in seconds, or null if still to be inferred
     */
    public Integer granularity() {
        return granularity;
    }

    public Rollup withGranularity(int granularity) {
        return new Rollup(interval, totals, orderby, granularity);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rollup)) return false;
        Rollup that = (Rollup) obj;
        return Objects.equals(interval, that.interval) &&
               Objects.equals(totals, that.totals) &&
               orderby == that.orderby &&
               Objects.equals(granularity, that.granularity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, totals, orderby, granularity);
    }

    @Override
    public String toString() {
        return "Rollup(interval=" + interval + ", totals=" + totals +
               ", orderby=" + orderby + ", granularity=" + granularity + ")";
    }

    // ==================== Factory Methods ====================

    public static Rollup ofInterval(int interval) {
        return new Rollup(interval, null, null, null);
    }

    public static Rollup ofInterval(int interval, int granularity) {
        return new Rollup(interval, null, null, granularity);
    }

    public static Rollup ofTotals() {
        return new Rollup(null, true, null, null);
    }

    public static Rollup ofTotals(Direction orderby) {
        return new Rollup(null, true, orderby, null);
    }
}
