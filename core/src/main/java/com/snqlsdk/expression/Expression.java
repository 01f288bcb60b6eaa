package com.snqlsdk.expression;

/**
 * Base interface for every node that can appear inside a query's clauses.
 *
 * <p>The set of expressions is closed:
 * <ul>
 *   <li>{@link Column} and {@link AliasedExpression} - column references</li>
 *   <li>{@link ScalarLiteral} - constants, including arrays and tuples of constants</li>
 *   <li>{@link FunctionCall} and {@link CurriedFunction} - function applications</li>
 *   <li>{@link Condition} and {@link BooleanCondition} - filters</li>
 *   <li>{@link Lambda} and {@link Identifier} - arguments of higher-order functions</li>
 * </ul>
 *
 * <p>Every implementation is {@code final}, immutable and compares structurally,
 * so trees can be shared freely between queries and threads. Traversals
 * (validation, printing) dispatch over the permitted subtypes and end in an
 * {@link UnsupportedOperationException} branch.
 */
public sealed interface Expression
    permits Column, AliasedExpression, ScalarLiteral, FunctionCall, CurriedFunction,
            Condition, BooleanCondition, Lambda, Identifier {
}
