package com.snqlsdk.metrics;

import java.util.List;
import java.util.Objects;

/**
 * Tenant filters applied to every metrics query: the organizations and projects
 * it may read, and optionally the use case all of its metrics belong to.
 */
public final class MetricsScope {

    private final List<Long> orgIds;
    private final List<Long> projectIds;
    private final String useCaseId;

    public MetricsScope(List<Long> orgIds, List<Long> projectIds, String useCaseId) {
        this.orgIds = List.copyOf(Objects.requireNonNull(orgIds, "orgIds must not be null"));
        this.projectIds = List.copyOf(Objects.requireNonNull(projectIds, "projectIds must not be null"));
        this.useCaseId = useCaseId;
    }

    public MetricsScope(List<Long> orgIds, List<Long> projectIds) {
        this(orgIds, projectIds, null);
    }

    public List<Long> orgIds() {
        return orgIds;
    }

    public List<Long> projectIds() {
        return projectIds;
    }

    /**
     * @return the use case id, or null if unset
     */
    public String useCaseId() {
        return useCaseId;
    }

    public MetricsScope withUseCaseId(String useCaseId) {
        return new MetricsScope(orgIds, projectIds, Objects.requireNonNull(useCaseId, "useCaseId must not be null"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MetricsScope)) return false;
        MetricsScope that = (MetricsScope) obj;
        return orgIds.equals(that.orgIds) &&
               projectIds.equals(that.projectIds) &&
               Objects.equals(useCaseId, that.useCaseId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orgIds, projectIds, useCaseId);
    }

    @Override
    public String toString() {
        return "MetricsScope(orgIds=" + orgIds + ", projectIds=" + projectIds +
               ", useCaseId=" + useCaseId + ")";
    }
}
