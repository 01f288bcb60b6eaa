package com.snqlsdk.logical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snqlsdk.exception.InvalidQueryException;
import com.snqlsdk.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deletes every row of a storage matching a set of column conditions.
 *
 * <p>Each entry maps a column to the values it may hold; entries are ANDed and
 * the values of one entry are ORed. For example
 * <pre>
 *   new DeleteQuery("search_issues", Map.of("project_id", List.of(1), "status", List.of("failed")))
 * </pre>
 * deletes the rows with {@code project_id IN (1) AND status IN ('failed')}.
 *
 * <p>Wire format: {@code {"columns": {"project_id": [1], "status": ["failed"]}}}.
 * Values are strings or integers.
 */
public final class DeleteQuery implements BaseQuery {

    private static final Logger logger = LoggerFactory.getLogger(DeleteQuery.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String storageName;
    private final Map<String, List<Object>> columnConditions;

    public DeleteQuery(String storageName, Map<String, ? extends List<?>> columnConditions) {
        this.storageName = Objects.requireNonNull(storageName, "storageName must not be null");
        Objects.requireNonNull(columnConditions, "columnConditions must not be null");
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends List<?>> entry : columnConditions.entrySet()) {
            Objects.requireNonNull(entry.getValue(), "values of column " + entry.getKey() + " must not be null");
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.columnConditions = Collections.unmodifiableMap(copy);
    }

    public String storageName() {
        return storageName;
    }

    public Map<String, List<Object>> columnConditions() {
        return columnConditions;
    }

    // ==================== Validation and rendering ====================

    @Override
    public void validate() {
        if (columnConditions.isEmpty()) {
            throw new InvalidQueryException("column conditions cannot be empty", "DeleteQuery", "delete-conditions");
        }
        for (Map.Entry<String, List<Object>> entry : columnConditions.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new InvalidQueryException(
                    "column condition '" + entry.getKey() + "' cannot be empty", "DeleteQuery", "delete-conditions");
            }
            for (Object value : entry.getValue()) {
                if (!isConditionValue(value)) {
                    throw new InvalidQueryException(
                        "column condition '" + entry.getKey() + "' must hold strings or integers, found " + value,
                        "DeleteQuery", "delete-condition-value");
                }
            }
        }
    }

    private static boolean isConditionValue(Object value) {
        return value instanceof String || value instanceof Integer || value instanceof Long ||
               value instanceof Short || value instanceof Byte;
    }

    @Override
    public String serialize() {
        try {
            String json = objectMapper.writeValueAsString(requestFields());
            logger.debug("Serialized delete on storage {}: {}", storageName, json);
            return json;
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("Failed to serialize delete query: " + e.getMessage(), "columns", e);
        }
    }

    @Override
    public String print() {
        return toString();
    }

    @Override
    public Map<String, Object> requestFields() {
        validate();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("columns", columnConditions);
        return fields;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DeleteQuery)) return false;
        DeleteQuery that = (DeleteQuery) obj;
        return storageName.equals(that.storageName) && columnConditions.equals(that.columnConditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storageName, columnConditions);
    }

    @Override
    public String toString() {
        return "DeleteQuery(storageName=" + storageName + ", columnConditions=" + columnConditions + ")";
    }
}
