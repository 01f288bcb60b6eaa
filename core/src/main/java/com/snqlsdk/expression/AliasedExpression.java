package com.snqlsdk.expression;

import com.snqlsdk.generator.ExpressionTranslator;
import com.snqlsdk.validation.Identifiers;

import java.util.Objects;

/**
 * A column renamed in the result set: {@code project_id AS `pid`}.
 *
 * <p>Only columns can be aliased this way; functions carry their own alias.
 */
public final class AliasedExpression implements Expression {

    private final Column expression;
    private final String alias;

    public AliasedExpression(Column expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        Identifiers.checkAlias(alias, "AliasedExpression");
        this.alias = alias;
    }

    public Column expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasedExpression)) return false;
        AliasedExpression that = (AliasedExpression) obj;
        return expression.equals(that.expression) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }

    public static AliasedExpression of(Column expression, String alias) {
        return new AliasedExpression(expression, alias);
    }
}
