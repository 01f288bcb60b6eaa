package com.snqlsdk.expression;

/**
 * Sort direction of an {@link OrderBy}.
 */
public enum Direction {
    ASC,
    DESC;

    /**
     * Parses a direction, ignoring case.
     *
     * @param value "ASC" or "DESC"
     * @return the direction
     * @throws IllegalArgumentException for any other value
     */
    public static Direction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Direction cannot be null");
        }
        switch (value.trim().toUpperCase()) {
            case "ASC":
                return ASC;
            case "DESC":
                return DESC;
            default:
                throw new IllegalArgumentException("Unknown direction: " + value);
        }
    }
}
