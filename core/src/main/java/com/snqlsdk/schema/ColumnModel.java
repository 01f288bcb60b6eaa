package com.snqlsdk.schema;

import java.util.Objects;

/**
 * One column of an entity schema.
 *
 * <p>A required column must be filtered with {@code =} or {@code IN} in every
 * query against the entity.
 */
public final class ColumnModel {

    private final String name;
    private final boolean required;

    public ColumnModel(String name, boolean required) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be empty");
        }
        this.required = required;
    }

    public String name() {
        return name;
    }

    public boolean required() {
        return required;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnModel)) return false;
        ColumnModel that = (ColumnModel) obj;
        return required == that.required && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, required);
    }

    @Override
    public String toString() {
        return required ? name + " (required)" : name;
    }

    public static ColumnModel optional(String name) {
        return new ColumnModel(name, false);
    }

    public static ColumnModel required(String name) {
        return new ColumnModel(name, true);
    }
}
