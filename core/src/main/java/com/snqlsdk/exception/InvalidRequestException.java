package com.snqlsdk.exception;

/**
 * Exception thrown when request-level fields are malformed: a missing or invalid
 * dataset or app id, an unknown flag, or a flag with the wrong value type.
 */
public class InvalidRequestException extends SnqlException {

    private final String field;

    public InvalidRequestException(String message, String field) {
        super(message);
        this.field = field;
    }

    public InvalidRequestException(String message, String field, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Returns the request field that was rejected.
     *
     * @return the field name, e.g. "dataset" or "flags.debug"
     */
    public String getField() {
        return field;
    }

    @Override
    protected void appendContext(StringBuilder sb) {
        if (field != null) {
            sb.append("Field: ").append(field).append('\n');
        }
    }
}
