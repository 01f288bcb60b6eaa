package com.snqlsdk.metrics;

import com.snqlsdk.exception.InvalidExpressionException;

import java.util.Objects;

/**
 * A raw metric, identified by public name ({@code transaction.duration}), MRI
 * ({@code d:transactions/duration@millisecond}) or both, plus an optional
 * resolved numeric id and the entity that stores it.
 */
public final class Metric {

    private final String publicName;
    private final String mri;
    private final Long id;
    private final String entity;

    public Metric(String publicName, String mri, Long id, String entity) {
        if (publicName == null && mri == null) {
            throw new InvalidExpressionException(
                "Metric must have at least one of public_name or mri", "Metric", "metric-name");
        }
        if (publicName != null && publicName.isEmpty()) {
            throw new InvalidExpressionException("public_name must not be empty", "Metric", "metric-name");
        }
        if (mri != null && mri.isEmpty()) {
            throw new InvalidExpressionException("mri must not be empty", "Metric", "metric-name");
        }
        this.publicName = publicName;
        this.mri = mri;
        this.id = id;
        this.entity = entity;
    }

    /**
     * @return the public name, or null
     */
    public String publicName() {
        return publicName;
    }

    /**
     * @return the MRI, or null
     */
    public String mri() {
        return mri;
    }

    /**
     * @return the resolved metric id, or null
     */
    public Long id() {
        return id;
    }

    /**
     * @return the entity storing this metric, or null if not yet bound
     */
    public String entity() {
        return entity;
    }

    /**
     * Returns the name used in MQL: the MRI when present, the public name otherwise.
     *
     * @return the MQL name
     */
    public String mqlName() {
        return mri != null ? mri : publicName;
    }

    public Metric withMri(String mri) {
        return new Metric(publicName, mri, id, entity);
    }

    public Metric withPublicName(String publicName) {
        return new Metric(publicName, mri, id, entity);
    }

    public Metric withId(long id) {
        return new Metric(publicName, mri, id, entity);
    }

    public Metric withEntity(String entity) {
        return new Metric(publicName, mri, id, entity);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Metric)) return false;
        Metric that = (Metric) obj;
        return Objects.equals(publicName, that.publicName) &&
               Objects.equals(mri, that.mri) &&
               Objects.equals(id, that.id) &&
               Objects.equals(entity, that.entity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(publicName, mri, id, entity);
    }

    @Override
    public String toString() {
        return "Metric(" + mqlName() + (entity != null ? ", entity=" + entity : "") + ")";
    }

    public static Metric ofPublicName(String publicName) {
        return new Metric(publicName, null, null, null);
    }

    public static Metric ofMri(String mri) {
        return new Metric(null, mri, null, null);
    }
}
