package com.snqlsdk.exception;

import java.util.List;
import java.util.Objects;

/**
 * Exception thrown when a query does not satisfy the entity schema it runs
 * against.
 *
 * <p>Every violation found in a validation pass is reported together, so a
 * caller can fix all of them in one iteration:
 * <pre>
 *   try {
 *       SchemaValidator.validate(query);
 *   } catch (SchemaValidationException e) {
 *       e.getViolations().forEach(System.err::println);
 *   }
 * </pre>
 */
public class SchemaValidationException extends SnqlException {

    private final String entity;
    private final List<String> violations;

    /**
     * Creates a schema validation exception.
     *
     * @param entity the name of the entity whose schema was violated (may be null
     *               when the violations span several entities)
     * @param violations every violation found, in discovery order; must not be empty
     */
    public SchemaValidationException(String entity, List<String> violations) {
        super(buildMessage(entity, violations));
        this.entity = entity;
        this.violations = List.copyOf(violations);
    }

    private static String buildMessage(String entity, List<String> violations) {
        Objects.requireNonNull(violations, "violations must not be null");
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        String prefix = entity != null
            ? "Schema validation failed for entity '" + entity + "': "
            : "Schema validation failed: ";
        return prefix + String.join("; ", violations);
    }

    public String getEntity() {
        return entity;
    }

    /**
     * Returns every violation found.
     *
     * @return immutable list of violation messages
     */
    public List<String> getViolations() {
        return violations;
    }

    @Override
    protected void appendContext(StringBuilder sb) {
        sb.append("Violations: ").append(violations.size()).append('\n');
        for (String violation : violations) {
            sb.append("  - ").append(violation).append('\n');
        }
    }
}
