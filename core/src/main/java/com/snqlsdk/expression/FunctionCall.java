package com.snqlsdk.expression;

import com.snqlsdk.generator.ExpressionTranslator;
import com.snqlsdk.validation.Identifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a function call: {@code count()}, {@code uniq(user_id)},
 * {@code arrayMap((`x`) -> plus(`x`, 1), values)}.
 *
 * <p>Functions may carry an output alias. Equality ignores the alias, so the
 * same call under two names compares equal.
 */
public final class FunctionCall implements Expression {

    private final String name;
    private final List<Expression> parameters;
    private final String alias;

    /**
     * Creates a function call.
     *
     * @param name the function name
     * @param parameters the arguments
     * @param alias the output alias (may be null)
     */
    public FunctionCall(String name, List<Expression> parameters, String alias) {
        Identifiers.checkFunctionName(name);
        if (alias != null) {
            Identifiers.checkAlias(alias, "function " + name);
        }
        this.name = name;
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.alias = alias;
    }

    public FunctionCall(String name, List<Expression> parameters) {
        this(name, parameters, null);
    }

    public String name() {
        return name;
    }

    public List<Expression> parameters() {
        return parameters;
    }

    /**
     * Returns the output alias.
     *
     * @return the alias, or null if none
     */
    public String alias() {
        return alias;
    }

    /**
     * Returns a copy of this call with the given alias.
     *
     * @param alias the new alias
     * @return the aliased call
     */
    public FunctionCall as(String alias) {
        return new FunctionCall(name, parameters, alias);
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return name.equals(that.name) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a function call, converting plain Java arguments to literals.
     *
     * @param name the function name
     * @param parameters expressions or plain values accepted by {@link ScalarLiteral#from(Object)}
     * @return the function call
     */
    public static FunctionCall of(String name, Object... parameters) {
        return new FunctionCall(name, toExpressions(parameters), null);
    }

    static List<Expression> toExpressions(Object... values) {
        List<Expression> expressions = new ArrayList<>(values.length);
        for (Object value : values) {
            if (value instanceof Expression) {
                expressions.add((Expression) value);
            } else {
                expressions.add(ScalarLiteral.from(value));
            }
        }
        return expressions;
    }
}
