package com.snqlsdk.parser;

import java.util.Objects;

/**
 * A token read by {@link MqlLexer}: its type, its text and where it starts.
 */
public final class MqlToken {

    public enum Type {
        NUMBER,
        NAME,
        METRIC,
        QUOTED_METRIC,
        STRING,
        TAG_KEY,
        TAG_VALUE,
        KEYWORD,
        PUNCTUATION
    }

    private final Type type;
    private final String text;
    private final int position;

    public MqlToken(Type type, String text, int position) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.position = position;
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the token text. For quoted strings and backticked metrics this is
     * the body between the delimiters, still escaped.
     *
     * @return the text
     */
    public String text() {
        return text;
    }

    public int position() {
        return position;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MqlToken)) return false;
        MqlToken that = (MqlToken) obj;
        return type == that.type && text.equals(that.text) && position == that.position;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, position);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
