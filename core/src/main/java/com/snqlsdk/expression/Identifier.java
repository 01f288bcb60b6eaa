package com.snqlsdk.expression;

import com.snqlsdk.generator.ExpressionTranslator;
import com.snqlsdk.validation.Identifiers;

/**
 * A lambda parameter referenced inside the lambda body, rendered as {@code `x`}.
 */
public final class Identifier implements Expression {

    private final String name;

    public Identifier(String name) {
        Identifiers.checkIdentifier(name);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Identifier)) return false;
        return name.equals(((Identifier) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }
}
