package com.snqlsdk.metrics;

/**
 * An operand of a {@link Formula}: a {@link Timeseries}, a nested
 * {@link Formula}, or a numeric {@link Constant}.
 */
public sealed interface FormulaParameter permits MetricsExpression, Constant {
}
