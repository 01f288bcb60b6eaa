package com.snqlsdk.logical;

/**
 * What a query reads from: a single {@link Entity} or {@link Storage}, a
 * {@link Join} of entities, or the result of an inner {@link Query}.
 */
public sealed interface MatchClause permits Entity, Storage, Join, Query {
}
