package com.snqlsdk.logical;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.schema.EntityModel;
import com.snqlsdk.validation.Identifiers;

import java.util.Objects;

/**
 * The target of a {@code MATCH} clause: {@code (events)}, {@code (e: events SAMPLE 0.1)}.
 *
 * <p>An entity may carry the caller-supplied {@link EntityModel} the schema
 * validator checks queries against. Entities used in joins or as column
 * qualifiers must have an alias.
 */
public final class Entity implements MatchClause {

    private final String name;
    private final String alias;        // Optional, required in joins
    private final Double sample;       // Optional sample rate or row count
    private final EntityModel dataModel; // Optional schema

    public Entity(String name, String alias, Double sample, EntityModel dataModel) {
        Identifiers.checkEntityName(name);
        if (alias != null && !Identifiers.isBareIdentifier(alias)) {
            throw new InvalidExpressionException(
                "'" + alias + "' is not a valid alias for entity " + name, "Entity", "entity-alias");
        }
        if (sample != null && (sample.isNaN() || sample.isInfinite() || sample <= 0.0)) {
            throw new InvalidExpressionException(
                "sample must be a float greater than 0, got " + sample, "Entity", "entity-sample");
        }
        if (dataModel != null && !dataModel.name().equals(name)) {
            throw new InvalidExpressionException(
                "data model '" + dataModel.name() + "' does not describe entity " + name,
                "Entity", "entity-data-model");
        }
        this.name = name;
        this.alias = alias;
        this.sample = sample;
        this.dataModel = dataModel;
    }

    public Entity(String name) {
        this(name, null, null, null);
    }

    public Entity(String name, String alias) {
        this(name, alias, null, null);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the alias.
     *
     * @return the alias, or null if none
     */
    public String alias() {
        return alias;
    }

    /**
     * Returns the sample rate (between 0 and 1) or row count (above 1).
     *
     * @return the sample, or null if unsampled
     */
    public Double sample() {
        return sample;
    }

    /**
     * Returns the schema attached to this entity.
     *
     * @return the schema, or null if the entity is not schema-checked
     */
    public EntityModel dataModel() {
        return dataModel;
    }

    public Entity withAlias(String alias) {
        return new Entity(name, alias, sample, dataModel);
    }

    public Entity withSample(double sample) {
        return new Entity(name, alias, sample, dataModel);
    }

    public Entity withDataModel(EntityModel dataModel) {
        return new Entity(name, alias, sample, dataModel);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Entity)) return false;
        Entity that = (Entity) obj;
        return name.equals(that.name) &&
               Objects.equals(alias, that.alias) &&
               Objects.equals(sample, that.sample) &&
               Objects.equals(dataModel, that.dataModel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias, sample, dataModel);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Entity(").append(name);
        if (alias != null) {
            sb.append(", alias=").append(alias);
        }
        if (sample != null) {
            sb.append(", sample=").append(sample);
        }
        return sb.append(')').toString();
    }
}
