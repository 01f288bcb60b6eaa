package com.snqlsdk.expression;

import com.snqlsdk.generator.ExpressionTranslator;
import com.snqlsdk.validation.Identifiers;

import java.util.List;
import java.util.Objects;

/**
 * Expression representing a parameterized (curried) function call, rendered as
 * chained call syntax: {@code quantile(0.95)(duration)},
 * {@code topK(10)(release) AS top_releases}.
 *
 * <p>The initializers configure the function and may only be literals or
 * columns; the parameters are the values the function is applied to. Equality
 * ignores the alias.
 */
public final class CurriedFunction implements Expression {

    private final String name;
    private final List<Expression> initializers;
    private final List<Expression> parameters;
    private final String alias;

    public CurriedFunction(String name, List<Expression> initializers,
                           List<Expression> parameters, String alias) {
        Identifiers.checkFunctionName(name);
        if (alias != null) {
            Identifiers.checkAlias(alias, "function " + name);
        }
        this.name = name;
        this.initializers = List.copyOf(Objects.requireNonNull(initializers, "initializers must not be null"));
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters must not be null"));
        this.alias = alias;
    }

    public String name() {
        return name;
    }

    public List<Expression> initializers() {
        return initializers;
    }

    public List<Expression> parameters() {
        return parameters;
    }

    public String alias() {
        return alias;
    }

    public CurriedFunction as(String alias) {
        return new CurriedFunction(name, initializers, parameters, alias);
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CurriedFunction)) return false;
        CurriedFunction that = (CurriedFunction) obj;
        return name.equals(that.name) &&
               initializers.equals(that.initializers) &&
               parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initializers, parameters);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a curried call, converting plain Java values to literals.
     *
     * @param name the function name
     * @param initializers initializer expressions or plain values
     * @param parameters parameter expressions or plain values
     * @return the curried call
     */
    public static CurriedFunction of(String name, List<?> initializers, List<?> parameters) {
        return new CurriedFunction(name,
            FunctionCall.toExpressions(initializers.toArray()),
            FunctionCall.toExpressions(parameters.toArray()),
            null);
    }
}
