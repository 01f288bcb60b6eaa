package com.snqlsdk.expression;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.generator.ExpressionTranslator;
import com.snqlsdk.logical.Entity;
import com.snqlsdk.validation.Identifiers;

import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Expression representing a reference to a column of the matched entity.
 *
 * <p>Column names may carry a subscript, in which case the column is a key
 * lookup into a map-like column:
 * <ul>
 *   <li>Simple: {@code project_id}, {@code contexts.key}</li>
 *   <li>Subscripted: {@code tags[release]} (subscriptable {@code tags}, key {@code release})</li>
 * </ul>
 *
 * <p>In a join, every column must name the entity it belongs to. That entity
 * must have an alias, which is used as the qualifier when printing:
 * {@code e.event_id}.
 */
public final class Column implements Expression {

    private final String name;
    private final Entity entity; // Optional entity qualifier
    private final String subscriptable;
    private final String key;

    /**
     * Creates a column reference.
     *
     * @param name the column name, optionally subscripted
     * @param entity the qualifying entity (may be null)
     * @throws InvalidExpressionException if the name is invalid or the entity has no alias
     */
    public Column(String name, Entity entity) {
        Identifiers.checkColumnName(name);
        if (entity != null && entity.alias() == null) {
            throw new InvalidExpressionException(
                "column '" + name + "' expects an entity with an alias", "Column", "entity-alias");
        }
        this.name = name;
        this.entity = entity;

        Matcher matcher = Identifiers.COLUMN_NAME.matcher(name);
        matcher.matches();
        if (matcher.group(2) != null) {
            this.subscriptable = name.substring(0, name.indexOf('['));
            this.key = matcher.group(3);
        } else {
            this.subscriptable = null;
            this.key = null;
        }
    }

    /**
     * Creates an unqualified column reference.
     *
     * @param name the column name
     */
    public Column(String name) {
        this(name, null);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the qualifying entity.
     *
     * @return the entity, or null if unqualified
     */
    public Entity entity() {
        return entity;
    }

    /**
     * Returns the map column of a subscripted reference.
     *
     * @return "tags" for {@code tags[release]}, null if not subscripted
     */
    public String subscriptable() {
        return subscriptable;
    }

    /**
     * Returns the key of a subscripted reference.
     *
     * @return "release" for {@code tags[release]}, null if not subscripted
     */
    public String key() {
        return key;
    }

    public boolean isSubscripted() {
        return subscriptable != null;
    }

    /**
     * Returns the name the entity schema knows this column by: the
     * subscriptable part for subscripted columns, the full name otherwise.
     *
     * @return the schema-level column name
     */
    public String baseName() {
        return subscriptable != null ? subscriptable : name;
    }

    /**
     * Returns a copy of this column qualified by the given entity.
     *
     * @param entity the entity (must have an alias)
     * @return the qualified column
     */
    public Column withEntity(Entity entity) {
        return new Column(name, entity);
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Column)) return false;
        Column that = (Column) obj;
        return Objects.equals(name, that.name) &&
               Objects.equals(entity, that.entity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entity);
    }

    // ==================== Factory Methods ====================

    public static Column of(String name) {
        return new Column(name);
    }

    public static Column of(String name, Entity entity) {
        return new Column(name, entity);
    }
}
