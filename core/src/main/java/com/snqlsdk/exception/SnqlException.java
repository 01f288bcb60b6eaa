package com.snqlsdk.exception;

/**
 * Base class for every error raised by the query SDK.
 *
 * <p>All SDK errors are unchecked. None of them is retried or downgraded by the
 * SDK itself: a caller that receives one must fix the offending input.
 *
 * <p>Subclasses:
 * <ul>
 *   <li>{@link InvalidExpressionException} - malformed node (structural error)</li>
 *   <li>{@link InvalidQueryException} - malformed query container</li>
 *   <li>{@link SchemaValidationException} - aggregated schema violations</li>
 *   <li>{@link InvalidRequestException} - malformed request fields or flags</li>
 *   <li>{@link MqlParseException} - MQL syntax error</li>
 * </ul>
 */
public abstract class SnqlException extends RuntimeException {

    protected SnqlException(String message) {
        super(message);
    }

    protected SnqlException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a short message suitable for showing to the author of the query.
     *
     * @return user-facing message
     */
    public String getUserMessage() {
        return getMessage();
    }

    /**
     * Returns a detailed message for debugging, including the error class and
     * any cause.
     *
     * @return technical error message
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append('\n');
        sb.append("Error: ").append(getMessage()).append('\n');
        appendContext(sb);
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Hook for subclasses to append their context fields to the technical message.
     *
     * @param sb the message being built
     */
    protected void appendContext(StringBuilder sb) {
    }
}
