package com.snqlsdk.exception;

/**
 * Exception thrown when a node of the query tree is malformed.
 *
 * <p>Raised eagerly by node constructors for cheap local checks, and
 * exhaustively by {@link com.snqlsdk.validation.StructuralValidator}. The
 * exception names the offending node and the rule it violated.
 *
 * <p>Example:
 * <pre>
 *   try {
 *       Column.of("bad column");
 *   } catch (InvalidExpressionException e) {
 *       e.getNode();  // "Column"
 *       e.getRule();  // "column-name"
 *   }
 * </pre>
 */
public class InvalidExpressionException extends SnqlException {

    private final String node;
    private final String rule;

    /**
     * Creates an exception for a malformed node.
     *
     * @param message the error message
     * @param node the kind of node that is malformed (e.g. "Column")
     * @param rule the violated rule (e.g. "column-name")
     */
    public InvalidExpressionException(String message, String node, String rule) {
        super(message);
        this.node = node;
        this.rule = rule;
    }

    /**
     * Creates an exception without node context.
     *
     * @param message the error message
     */
    public InvalidExpressionException(String message) {
        this(message, null, null);
    }

    public String getNode() {
        return node;
    }

    public String getRule() {
        return rule;
    }

    @Override
    public String getUserMessage() {
        if (node == null) {
            return getMessage();
        }
        return "Invalid " + node + ": " + getMessage();
    }

    @Override
    protected void appendContext(StringBuilder sb) {
        if (node != null) {
            sb.append("Node: ").append(node).append('\n');
        }
        if (rule != null) {
            sb.append("Rule: ").append(rule).append('\n');
        }
    }
}
