package com.snqlsdk.logical;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.schema.EntityModel;
import com.snqlsdk.validation.Identifiers;

import java.util.Objects;

/**
 * A storage read directly, bypassing entity processing:
 * {@code STORAGE(events)}, {@code STORAGE(events SAMPLE 0.100000)}.
 *
 * <p>Storages have no alias, so they cannot appear in joins or qualify columns.
 */
public final class Storage implements MatchClause {

    private final String name;
    private final Double sample;       // Optional sample rate or row count
    private final EntityModel dataModel; // Optional schema

    public Storage(String name, Double sample, EntityModel dataModel) {
        Identifiers.checkStorageName(name);
        if (sample != null && (sample.isNaN() || sample.isInfinite() || sample <= 0.0)) {
            throw new InvalidExpressionException(
                "samples must be greater than 0.0, got " + sample, "Storage", "storage-sample");
        }
        this.name = name;
        this.sample = sample;
        this.dataModel = dataModel;
    }

    public Storage(String name) {
        this(name, null, null);
    }

    public Storage(String name, double sample) {
        this(name, sample, null);
    }

    public String name() {
        return name;
    }

    /**
     * @return the sample, or null if unsampled
     */
    public Double sample() {
        return sample;
    }

    /**
     * @return the schema, or null if the storage is not schema-checked
     */
    public EntityModel dataModel() {
        return dataModel;
    }

    public Storage withSample(double sample) {
        return new Storage(name, sample, dataModel);
    }

    public Storage withDataModel(EntityModel dataModel) {
        return new Storage(name, sample, dataModel);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Storage)) return false;
        Storage that = (Storage) obj;
        return name.equals(that.name) &&
               Objects.equals(sample, that.sample) &&
               Objects.equals(dataModel, that.dataModel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sample, dataModel);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Storage(").append(name);
        if (sample != null) {
            sb.append(", sample=").append(sample);
        }
        return sb.append(')').toString();
    }
}
