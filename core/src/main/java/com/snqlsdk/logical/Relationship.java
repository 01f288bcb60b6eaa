package com.snqlsdk.logical;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.validation.Identifiers;

import java.util.Objects;

/**
 * A named relationship between two entities, one edge of a {@link Join}:
 * {@code (e: events) -[grouped]-> (g: groupedmessage)}.
 */
public final class Relationship {

    private final Entity lhs;
    private final String name;
    private final Entity rhs;

    public Relationship(Entity lhs, String name, Entity rhs) {
        this.lhs = requireAliased(lhs, "lhs");
        this.rhs = requireAliased(rhs, "rhs");
        if (!Identifiers.isBareIdentifier(name)) {
            throw new InvalidExpressionException(
                "'" + name + "' is not a valid relationship name", "Relationship", "relationship-name");
        }
        this.name = name;
    }

    private static Entity requireAliased(Entity entity, String side) {
        Objects.requireNonNull(entity, side + " must not be null");
        if (entity.alias() == null) {
            throw new InvalidExpressionException(
                side + " entity " + entity.name() + " must have an alias", "Relationship", "entity-alias");
        }
        return entity;
    }

    public Entity lhs() {
        return lhs;
    }

    public String name() {
        return name;
    }

    public Entity rhs() {
        return rhs;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Relationship)) return false;
        Relationship that = (Relationship) obj;
        return lhs.equals(that.lhs) && name.equals(that.name) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, name, rhs);
    }

    @Override
    public String toString() {
        return lhs.alias() + " -[" + name + "]-> " + rhs.alias();
    }
}
