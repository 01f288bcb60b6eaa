package com.snqlsdk.parser;

import com.snqlsdk.exception.MqlParseException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Character scanner for MQL.
 *
 * <p>What counts as a token depends on where the parser is: inside a filter
 * block {@code 2023-01-03T10:00:00} is a single tag value, outside it
 * {@code d:transactions/duration@millisecond} is a single metric name. The
 * lexer therefore does not pre-tokenize; the parser asks for the kind of
 * token it expects next and gets either that token or {@code null}. Every read
 * skips leading whitespace first.
 *
 * <p>The position can be saved and restored, which the parser uses to try one
 * alternative of the grammar and fall back to the next.
 */
public final class MqlLexer {

    static final Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]+)?");
    static final Pattern NAME = Pattern.compile("[a-zA-Z0-9_]+");
    static final Pattern UNQUOTED_MRI = Pattern.compile(
        "[^:(){}\\[\\]\"`,\\s]+:[^/(){}\\[\\]\"`,\\s]+/[^@(){}\\[\\]\"`,\\s]+@[^(){}\\[\\]\"`,\\s]+");
    static final Pattern PUBLIC_NAME = Pattern.compile("[a-z_]+(\\.[a-z_]+)*");
    static final Pattern TAG_KEY = Pattern.compile("[a-zA-Z0-9_.]+");
    static final Pattern UNQUOTED_VALUE = Pattern.compile("[^,\\[\\]\"{}()\\s*]+");

    private static final String EOF = "<EOF>";
    private static final int SNIPPET_LENGTH = 20;

    private final String input;
    private final Matcher matcher;
    private int position;

    public MqlLexer(String input) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.matcher = Pattern.compile("").matcher(input);
        this.position = 0;
    }

    public int position() {
        return position;
    }

    /**
     * Moves back to a position previously returned by {@link #position()}.
     *
     * @param position the saved position
     */
    public void reset(int position) {
        if (position < 0 || position > input.length()) {
            throw new IllegalArgumentException("position " + position + " is outside the input");
        }
        this.position = position;
    }

    public void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    /**
     * Returns true once only whitespace remains.
     */
    public boolean atEnd() {
        skipWhitespace();
        return position >= input.length();
    }

    /**
     * Returns the next non-whitespace character without consuming it.
     *
     * @return the character, or 0 at the end of input
     */
    public char peek() {
        skipWhitespace();
        return position < input.length() ? input.charAt(position) : 0;
    }

    /**
     * Returns the character at the current position, whitespace included.
     *
     * @return the character, or 0 at the end of input
     */
    public char peekRaw() {
        return position < input.length() ? input.charAt(position) : 0;
    }

    /**
     * Consumes {@code c} if it is the next non-whitespace character.
     */
    public boolean tryConsume(char c) {
        if (peek() == c && position < input.length()) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Consumes {@code c} only if it is at the current position, with no
     * whitespace before it.
     */
    public boolean tryConsumeRaw(char c) {
        if (peekRaw() == c && position < input.length()) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Consumes {@code c} or fails.
     *
     * @param c the expected character
     * @return the token read
     * @throws MqlParseException if the next character is something else
     */
    public MqlToken expect(char c) {
        int start = tokenStart();
        if (!tryConsume(c)) {
            throw error("expected '" + c + "'");
        }
        return new MqlToken(MqlToken.Type.PUNCTUATION, String.valueOf(c), start);
    }

    /**
     * Returns true if one of {@code words} comes next as a whole word.
     */
    public boolean peekKeyword(String... words) {
        skipWhitespace();
        for (String word : words) {
            int end = position + word.length();
            if (input.startsWith(word, position) && (end >= input.length() || !isWordChar(input.charAt(end)))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Consumes one of {@code words} if it comes next as a whole word.
     *
     * @return the keyword token, or null
     */
    public MqlToken tryKeyword(String... words) {
        skipWhitespace();
        for (String word : words) {
            int end = position + word.length();
            if (input.startsWith(word, position) && (end >= input.length() || !isWordChar(input.charAt(end)))) {
                MqlToken token = new MqlToken(MqlToken.Type.KEYWORD, word, position);
                position = end;
                return token;
            }
        }
        return null;
    }

    // A keyword followed by one of these is the start of a longer name or a tag key.
    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':';
    }

    /**
     * Reads the longest match of {@code pattern} at the next non-whitespace
     * position.
     *
     * @param pattern the token pattern
     * @param type the type of the token
     * @return the token, or null if the pattern does not match there
     */
    public MqlToken read(Pattern pattern, MqlToken.Type type) {
        skipWhitespace();
        if (position >= input.length()) {
            return null;
        }
        matcher.usePattern(pattern);
        matcher.region(position, input.length());
        if (!matcher.lookingAt()) {
            return null;
        }
        MqlToken token = new MqlToken(type, matcher.group(), position);
        position = matcher.end();
        return token;
    }

    /**
     * Reads a string delimited by {@code quote}. A backslash escapes the
     * character after it; the body is returned still escaped.
     *
     * @param quote the delimiter
     * @param type the type of the token
     * @return the token holding the body, or null if no quote comes next
     * @throws MqlParseException if the string is not terminated
     */
    public MqlToken readQuoted(char quote, MqlToken.Type type) {
        skipWhitespace();
        if (peekRaw() != quote) {
            return null;
        }
        int start = position;
        int i = position + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                position = i + 1;
                return new MqlToken(type, input.substring(start + 1, i), start);
            }
            i++;
        }
        throw new MqlParseException("unterminated string", start, tokenAt(start));
    }

    // ==================== Errors ====================

    /**
     * Creates a parse error located at the next token.
     *
     * @param message what was expected
     * @return the exception, to be thrown by the caller
     */
    public MqlParseException error(String message) {
        int start = tokenStart();
        return new MqlParseException(message, start, tokenAt(start));
    }

    /**
     * Creates a parse error located at {@code start}.
     */
    public MqlParseException errorAt(String message, int start) {
        return new MqlParseException(message, start, tokenAt(start));
    }

    private int tokenStart() {
        skipWhitespace();
        return position;
    }

    /**
     * Returns the text of the token starting at {@code start}, as shown in errors.
     *
     * @param start a position in the input
     * @return up to the next whitespace, or "&lt;EOF&gt;" at the end of input
     */
    public String tokenAt(int start) {
        if (start >= input.length()) {
            return EOF;
        }
        int end = start;
        while (end < input.length() && end - start < SNIPPET_LENGTH && !Character.isWhitespace(input.charAt(end))) {
            end++;
        }
        return end == start ? input.substring(start, start + 1) : input.substring(start, end);
    }
}
