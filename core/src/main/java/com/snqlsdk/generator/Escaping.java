package com.snqlsdk.generator;

/**
 * The single escaping routine shared by both dialect printers and the MQL parser.
 *
 * <p>Escape rules, applied inside a string delimited by {@code quote}:
 * <ul>
 *   <li>{@code \} becomes {@code \\}</li>
 *   <li>the delimiter becomes {@code \'} or {@code \"}</li>
 *   <li>newline, carriage return and tab become {@code \n}, {@code \r}, {@code \t}</li>
 *   <li>any other control character becomes {@code \xHH}</li>
 * </ul>
 *
 * <p>{@link #unescape(String, char)} is the exact inverse of
 * {@link #escape(String, char)}, so every string survives a print/parse round trip.
 *
 * <p>Example usage:
 * <pre>
 *   Escaping.quote("O'Reilly", '\'');      // 'O\'Reilly'
 *   Escaping.quote("a \"b\"", '"');        // "a \"b\""
 * </pre>
 */
public final class Escaping {

    private Escaping() {} // Utility class

    public static final char SINGLE_QUOTE = '\'';
    public static final char DOUBLE_QUOTE = '"';

    /**
     * Escapes a string for use between the given delimiters.
     *
     * @param value the raw string
     * @param quote the delimiter the result will be wrapped in
     * @return the escaped body (without delimiters)
     */
    public static String escape(String value, char quote) {
        if (value == null) {
            throw new IllegalArgumentException("Value to escape cannot be null");
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c == quote) {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c == 0x7f) {
                sb.append(String.format("\\x%02x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes a string and wraps it in the given delimiters.
     *
     * @param value the raw string
     * @param quote the delimiter
     * @return the quoted literal
     */
    public static String quote(String value, char quote) {
        return quote + escape(value, quote) + quote;
    }

    /**
     * Reverses {@link #escape(String, char)}.
     *
     * @param body the escaped body (without delimiters)
     * @param quote the delimiter the body was wrapped in
     * @return the raw string
     * @throws IllegalArgumentException on a dangling backslash, an unknown escape
     *         sequence, or an unescaped delimiter
     */
    public static String unescape(String body, char quote) {
        if (body == null) {
            throw new IllegalArgumentException("Value to unescape cannot be null");
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == quote) {
                throw new IllegalArgumentException("Unescaped delimiter at offset " + i);
            }
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= body.length()) {
                throw new IllegalArgumentException("Dangling escape character at offset " + i);
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case '\\':
                    sb.append('\\');
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'x':
                    if (i + 3 >= body.length()) {
                        throw new IllegalArgumentException("Truncated \\x escape at offset " + i);
                    }
                    try {
                        sb.append((char) Integer.parseInt(body.substring(i + 2, i + 4), 16));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid \\x escape at offset " + i, e);
                    }
                    i += 2;
                    break;
                default:
                    if (next != quote) {
                        throw new IllegalArgumentException(
                            "Unknown escape sequence '\\" + next + "' at offset " + i);
                    }
                    sb.append(next);
            }
            i += 2;
        }
        return sb.toString();
    }
}
