package com.snqlsdk.logical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.snqlsdk.config.QueryLimits;
import com.snqlsdk.exception.InvalidRequestException;
import com.snqlsdk.validation.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The envelope sent to the query engine: a query plus the dataset it runs on,
 * the calling application, flags and tenant identifiers.
 *
 * <p>Wire format (JSON object, field set fixed):
 * <pre>
 * {
 *   "debug": true,                 // one entry per set flag
 *   "query": "MATCH (events) ...", // or MQL text for metrics queries
 *   "mql_context": {...},          // metrics queries only
 *   "columns": {"id": [1, 2]},     // delete queries, in place of "query"
 *   "dataset": "events",
 *   "app_id": "my_app",
 *   "tenant_ids": {"organization_id": 1},
 *   "parent_api": "&lt;unknown&gt;"
 * }
 * </pre>
 */
public final class Request {

    private static final Logger logger = LoggerFactory.getLogger(Request.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final ObjectMapper prettyMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final String dataset;
    private final String appId;
    private final BaseQuery query;
    private final Flags flags;
    private final Map<String, Object> tenantIds;
    private final String parentApi;

    public Request(String dataset, String appId, BaseQuery query, Flags flags,
                   Map<String, ?> tenantIds, String parentApi) {
        this.dataset = dataset;
        this.appId = appId;
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.flags = flags != null ? flags : Flags.none();
        Map<String, Object> tenants = new LinkedHashMap<>();
        if (tenantIds != null) {
            tenants.putAll(tenantIds);
        }
        this.tenantIds = Collections.unmodifiableMap(tenants);
        this.parentApi = parentApi != null ? parentApi : QueryLimits.DEFAULT_PARENT_API;
    }

    public Request(String dataset, String appId, BaseQuery query) {
        this(dataset, appId, query, null, null, null);
    }

    public String dataset() {
        return dataset;
    }

    public String appId() {
        return appId;
    }

    public BaseQuery query() {
        return query;
    }

    public Flags flags() {
        return flags;
    }

    public Map<String, Object> tenantIds() {
        return tenantIds;
    }

    public String parentApi() {
        return parentApi;
    }

    public Request withFlags(Flags flags) {
        return new Request(dataset, appId, query, flags, tenantIds, parentApi);
    }

    public Request withTenantIds(Map<String, ?> tenantIds) {
        return new Request(dataset, appId, query, flags, tenantIds, parentApi);
    }

    public Request withParentApi(String parentApi) {
        return new Request(dataset, appId, query, flags, tenantIds, parentApi);
    }

    public Request withQuery(BaseQuery query) {
        return new Request(dataset, appId, query, flags, tenantIds, parentApi);
    }

    /**
     * Validates the request fields and then the query.
     *
     * @throws InvalidRequestException if a request field is malformed
     */
    public void validate() {
        checkField(dataset, "dataset");
        checkField(appId, "app_id");
        if (parentApi.isEmpty()) {
            throw new InvalidRequestException("`" + parentApi + "` is not a valid parent_api", "parent_api");
        }
        for (Map.Entry<String, Object> entry : tenantIds.entrySet()) {
            Object value = entry.getValue();
            if (!(value instanceof String) && !(value instanceof Integer) && !(value instanceof Long)) {
                throw new InvalidRequestException(
                    "tenant id '" + entry.getKey() + "' must be a string or an integer",
                    "tenant_ids." + entry.getKey());
            }
        }
        query.validate();
    }

    private static void checkField(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidRequestException("Request must have a valid " + field, field);
        }
        if (!Identifiers.REQUEST_FIELD.matcher(value).matches()) {
            throw new InvalidRequestException("'" + value + "' is not a valid " + field, field);
        }
    }

    /**
     * Validates the request and builds its body.
     *
     * @return ordered body fields
     */
    public Map<String, Object> toMap() {
        validate();
        Map<String, Object> body = new LinkedHashMap<>(flags.toMap());
        body.putAll(query.requestFields());
        body.put("dataset", dataset);
        body.put("app_id", appId);
        body.put("tenant_ids", tenantIds);
        body.put("parent_api", parentApi);
        return body;
    }

    /**
     * Validates the request and renders it as compact JSON.
     *
     * @return the request body
     */
    public String serialize() {
        String json = writeJson(objectMapper, toMap());
        logger.debug("Serialized request for dataset {}: {}", dataset, json);
        return json;
    }

    /**
     * Validates the request and renders it as indented JSON with sorted keys.
     *
     * @return the readable request body
     */
    public String print() {
        return writeJson(prettyMapper, toMap());
    }

    private static String writeJson(ObjectMapper mapper, Map<String, Object> body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Failed to serialize request: " + e.getMessage(), "request", e);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Request)) return false;
        Request that = (Request) obj;
        return Objects.equals(dataset, that.dataset) &&
               Objects.equals(appId, that.appId) &&
               query.equals(that.query) &&
               flags.equals(that.flags) &&
               tenantIds.equals(that.tenantIds) &&
               parentApi.equals(that.parentApi);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataset, appId, query, flags, tenantIds, parentApi);
    }

    @Override
    public String toString() {
        return "Request(dataset=" + dataset + ", app_id=" + appId + ", query=" + query + ")";
    }
}
