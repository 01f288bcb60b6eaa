package com.snqlsdk.logical;

import com.snqlsdk.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A join of several entities along named relationships. Every alias maps to
 * exactly one entity across all relationships.
 */
public final class Join implements MatchClause {

    private final List<Relationship> relationships;
    private final Map<String, Entity> entitiesByAlias;

    public Join(List<Relationship> relationships) {
        Objects.requireNonNull(relationships, "relationships must not be null");
        if (relationships.isEmpty()) {
            throw new InvalidExpressionException(
                "join must have at least one relationship", "Join", "join-relationships");
        }
        this.relationships = List.copyOf(relationships);

        Map<String, Entity> byAlias = new LinkedHashMap<>();
        for (Relationship relationship : this.relationships) {
            register(byAlias, relationship.lhs());
            register(byAlias, relationship.rhs());
        }
        this.entitiesByAlias = byAlias;
    }

    private static void register(Map<String, Entity> byAlias, Entity entity) {
        Entity existing = byAlias.putIfAbsent(entity.alias(), entity);
        if (existing != null && !existing.name().equals(entity.name())) {
            throw new InvalidExpressionException(
                "alias '" + entity.alias() + "' is used for both " + existing.name() +
                " and " + entity.name(), "Join", "join-alias");
        }
    }

    public List<Relationship> relationships() {
        return relationships;
    }

    /**
     * Returns each joined entity once, in first-seen order.
     *
     * @return the entities
     */
    public List<Entity> entities() {
        return new ArrayList<>(entitiesByAlias.values());
    }

    /**
     * Resolves an alias to its entity.
     *
     * @param alias the alias
     * @return the entity, or null if the alias is unknown
     */
    public Entity entity(String alias) {
        return entitiesByAlias.get(alias);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Join)) return false;
        return relationships.equals(((Join) obj).relationships);
    }

    @Override
    public int hashCode() {
        return relationships.hashCode();
    }

    @Override
    public String toString() {
        return "Join" + relationships;
    }
}
