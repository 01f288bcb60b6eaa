package com.snqlsdk.expression;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.generator.ExpressionTranslator;
import com.snqlsdk.validation.Identifiers;

import java.util.List;
import java.util.Objects;

/**
 * An anonymous function passed to a higher-order function:
 * {@code (`x`, `y`) -> plus(`x`, `y`)}.
 *
 * <p>The body must be a function call; identifiers used in the body are
 * {@link Identifier} nodes.
 */
public final class Lambda implements Expression {

    private final List<String> identifiers;
    private final Expression body;

    public Lambda(List<String> identifiers, Expression body) {
        Objects.requireNonNull(identifiers, "identifiers must not be null");
        if (identifiers.isEmpty()) {
            throw new InvalidExpressionException(
                "lambda requires at least one identifier", "Lambda", "lambda-identifiers");
        }
        for (String identifier : identifiers) {
            Identifiers.checkIdentifier(identifier);
        }
        this.identifiers = List.copyOf(identifiers);
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public List<String> identifiers() {
        return identifiers;
    }

    public Expression body() {
        return body;
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Lambda)) return false;
        Lambda that = (Lambda) obj;
        return identifiers.equals(that.identifiers) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifiers, body);
    }
}
