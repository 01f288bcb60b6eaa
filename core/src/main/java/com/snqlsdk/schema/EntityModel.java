package com.snqlsdk.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static schema of an entity: its queryable columns and the time column every
 * query must bound with {@code >=} and {@code <} conditions.
 *
 * <p>Schemas are supplied by the caller; the SDK never infers them.
 *
 * <p>Example:
 * <pre>
 *   EntityModel events = EntityModel.builder("events")
 *       .required("project_id")
 *       .column("event_id")
 *       .timeColumn("timestamp")
 *       .build();
 * </pre>
 */
public final class EntityModel {

    private final String name;
    private final Map<String, ColumnModel> columns;
    private final ColumnModel requiredTimeColumn;

    /**
     * Creates an entity schema.
     *
     * @param name the entity name
     * @param columns the columns, in declaration order
     * @param requiredTimeColumn the time column; added to the column set if absent
     * @throws IllegalArgumentException on duplicate column names
     */
    public EntityModel(String name, List<ColumnModel> columns, ColumnModel requiredTimeColumn) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        this.requiredTimeColumn = Objects.requireNonNull(requiredTimeColumn, "requiredTimeColumn must not be null");

        Map<String, ColumnModel> byName = new LinkedHashMap<>();
        for (ColumnModel column : columns) {
            if (byName.put(column.name(), column) != null) {
                throw new IllegalArgumentException(
                    "Duplicate column '" + column.name() + "' in entity " + name);
            }
        }
        byName.putIfAbsent(requiredTimeColumn.name(), requiredTimeColumn);
        this.columns = Collections.unmodifiableMap(byName);
    }

    public String name() {
        return name;
    }

    public List<ColumnModel> columns() {
        return List.copyOf(columns.values());
    }

    public ColumnModel requiredTimeColumn() {
        return requiredTimeColumn;
    }

    /**
     * Returns the required columns other than the time column.
     *
     * @return required columns, in declaration order
     */
    public List<ColumnModel> requiredColumns() {
        List<ColumnModel> required = new ArrayList<>();
        for (ColumnModel column : columns.values()) {
            if (column.required() && !column.name().equals(requiredTimeColumn.name())) {
                required.add(column);
            }
        }
        return required;
    }

    public boolean contains(String columnName) {
        return columns.containsKey(columnName);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EntityModel)) return false;
        EntityModel that = (EntityModel) obj;
        return name.equals(that.name) &&
               columns.equals(that.columns) &&
               requiredTimeColumn.equals(that.requiredTimeColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, requiredTimeColumn);
    }

    @Override
    public String toString() {
        return "EntityModel(" + name + ", columns=" + columns.keySet() +
               ", time=" + requiredTimeColumn.name() + ")";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for {@link EntityModel}.
     */
    public static final class Builder {
        private final String name;
        private final List<ColumnModel> columns = new ArrayList<>();
        private ColumnModel timeColumn;

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(String columnName) {
            columns.add(ColumnModel.optional(columnName));
            return this;
        }

        public Builder required(String columnName) {
            columns.add(ColumnModel.required(columnName));
            return this;
        }

        public Builder timeColumn(String columnName) {
            this.timeColumn = ColumnModel.required(columnName);
            return this;
        }

        public EntityModel build() {
            if (timeColumn == null) {
                throw new IllegalStateException("Entity " + name + " requires a time column");
            }
            return new EntityModel(name, columns, timeColumn);
        }
    }
}
