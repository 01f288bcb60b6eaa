package com.snqlsdk.exception;

/**
 * Exception thrown when MQL text cannot be parsed.
 *
 * <p>The parser never attempts recovery: the first syntax error aborts the
 * parse. The exception carries the zero-based character offset of the offending
 * token and the token text itself.
 */
public class MqlParseException extends SnqlException {

    private final int position;
    private final String token;

    /**
     * Creates a parse exception.
     *
     * @param message description of what was expected
     * @param position zero-based offset of the offending token in the input
     * @param token the offending token text ("&lt;EOF&gt;" at end of input)
     */
    public MqlParseException(String message, int position, String token) {
        super(message + " at position " + position + " near '" + token + "'");
        this.position = position;
        this.token = token;
    }

    /**
     * Creates a parse exception wrapping a node construction failure.
     *
     * @param message description of the failure
     * @param position zero-based offset in the input
     * @param token the offending token text
     * @param cause the underlying failure
     */
    public MqlParseException(String message, int position, String token, Throwable cause) {
        super(message + " at position " + position + " near '" + token + "'", cause);
        this.position = position;
        this.token = token;
    }

    public int getPosition() {
        return position;
    }

    public String getToken() {
        return token;
    }

    @Override
    public String getUserMessage() {
        return "Invalid MQL syntax: " + getMessage();
    }

    @Override
    protected void appendContext(StringBuilder sb) {
        sb.append("Position: ").append(position).append('\n');
        sb.append("Token: ").append(token).append('\n');
    }
}
