package com.snqlsdk.expression;

import com.snqlsdk.exception.InvalidExpressionException;
import com.snqlsdk.generator.ExpressionTranslator;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>Supported kinds and their Java representation:
 * <ul>
 *   <li>NULL - no value</li>
 *   <li>BOOLEAN - {@link Boolean}</li>
 *   <li>INTEGER - {@link Long}</li>
 *   <li>FLOAT - finite {@link Double}</li>
 *   <li>STRING - {@link String}</li>
 *   <li>DATE - {@link LocalDate}</li>
 *   <li>DATETIME - naive UTC {@link LocalDateTime}, microsecond precision</li>
 *   <li>ARRAY - list of scalars sharing one kind (NULL allowed anywhere,
 *       INTEGER and FLOAT may be mixed)</li>
 *   <li>TUPLE - list of scalars of any kind</li>
 * </ul>
 *
 * <p>Zoned date-times are converted to UTC on construction; the engine expects
 * naive UTC values.
 */
public final class ScalarLiteral implements Expression {

    /**
     * The kind of value a literal holds.
     */
    public enum Kind {
        NULL,
        BOOLEAN,
        INTEGER,
        FLOAT,
        STRING,
        DATE,
        DATETIME,
        ARRAY,
        TUPLE;

        public boolean isNumeric() {
            return this == INTEGER || this == FLOAT;
        }

        public boolean isSequence() {
            return this == ARRAY || this == TUPLE;
        }

        public boolean isTemporal() {
            return this == DATE || this == DATETIME;
        }
    }

    private static final ScalarLiteral NULL_LITERAL = new ScalarLiteral(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private ScalarLiteral(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the raw value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean asBoolean() {
        return (Boolean) requireKind(Kind.BOOLEAN);
    }

    public long asLong() {
        return (Long) requireKind(Kind.INTEGER);
    }

    /**
     * Returns a numeric value as a double.
     *
     * @return the value of an INTEGER or FLOAT literal
     */
    public double asDouble() {
        if (kind == Kind.INTEGER) {
            return ((Long) value).doubleValue();
        }
        return (Double) requireKind(Kind.FLOAT);
    }

    public String asString() {
        return (String) requireKind(Kind.STRING);
    }

    public LocalDate asDate() {
        return (LocalDate) requireKind(Kind.DATE);
    }

    public LocalDateTime asDateTime() {
        return (LocalDateTime) requireKind(Kind.DATETIME);
    }

    /**
     * Returns the elements of an ARRAY or TUPLE literal.
     *
     * @return immutable list of elements
     */
    @SuppressWarnings("unchecked")
    public List<ScalarLiteral> elements() {
        if (!kind.isSequence()) {
            throw new IllegalStateException("Literal of kind " + kind + " has no elements");
        }
        return (List<ScalarLiteral>) value;
    }

    private Object requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Literal is " + kind + ", not " + expected);
        }
        return value;
    }

    @Override
    public String toString() {
        return ExpressionTranslator.toText(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScalarLiteral)) return false;
        ScalarLiteral that = (ScalarLiteral) obj;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    // ==================== Factory Methods ====================

    public static ScalarLiteral nullValue() {
        return NULL_LITERAL;
    }

    public static ScalarLiteral of(boolean value) {
        return new ScalarLiteral(Kind.BOOLEAN, value);
    }

    public static ScalarLiteral of(long value) {
        return new ScalarLiteral(Kind.INTEGER, value);
    }

    public static ScalarLiteral of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidExpressionException(
                "float literal must be finite, got " + value, "ScalarLiteral", "finite-float");
        }
        return new ScalarLiteral(Kind.FLOAT, value);
    }

    public static ScalarLiteral of(String value) {
        return new ScalarLiteral(Kind.STRING, Objects.requireNonNull(value, "value must not be null"));
    }

    public static ScalarLiteral of(LocalDate value) {
        return new ScalarLiteral(Kind.DATE, Objects.requireNonNull(value, "value must not be null"));
    }

    /**
     * Creates a datetime literal from a naive value, which is taken to be UTC.
     *
     * @param value the naive UTC date-time
     * @return the literal, truncated to microseconds
     */
    public static ScalarLiteral of(LocalDateTime value) {
        Objects.requireNonNull(value, "value must not be null");
        return new ScalarLiteral(Kind.DATETIME, value.truncatedTo(ChronoUnit.MICROS));
    }

    public static ScalarLiteral of(ZonedDateTime value) {
        Objects.requireNonNull(value, "value must not be null");
        return of(value.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }

    public static ScalarLiteral of(OffsetDateTime value) {
        Objects.requireNonNull(value, "value must not be null");
        return of(value.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
    }

    public static ScalarLiteral of(Instant value) {
        Objects.requireNonNull(value, "value must not be null");
        return of(LocalDateTime.ofInstant(value, ZoneOffset.UTC));
    }

    /**
     * Creates an array literal. All non-null elements must share one kind.
     *
     * @param elements the elements
     * @return the array literal
     * @throws InvalidExpressionException if the elements are of mixed kinds
     */
    public static ScalarLiteral array(List<ScalarLiteral> elements) {
        List<ScalarLiteral> copy = List.copyOf(elements);
        checkHomogeneous(copy);
        return new ScalarLiteral(Kind.ARRAY, copy);
    }

    public static ScalarLiteral array(ScalarLiteral... elements) {
        return array(Arrays.asList(elements));
    }

    /**
     * Creates a tuple literal. Elements may be of different kinds.
     *
     * @param elements the elements
     * @return the tuple literal
     */
    public static ScalarLiteral tuple(List<ScalarLiteral> elements) {
        return new ScalarLiteral(Kind.TUPLE, List.copyOf(elements));
    }

    public static ScalarLiteral tuple(ScalarLiteral... elements) {
        return tuple(Arrays.asList(elements));
    }

    /**
     * Converts a plain Java value to a literal.
     *
     * <p>Accepts null, {@link Boolean}, integral and floating-point {@link Number}s,
     * {@link String}, the {@code java.time} date and date-time types, and
     * collections of those (converted to an ARRAY).
     *
     * @param value the value
     * @return the literal
     * @throws InvalidExpressionException if the value has no literal representation
     */
    public static ScalarLiteral from(Object value) {
        if (value == null) {
            return NULL_LITERAL;
        } else if (value instanceof ScalarLiteral) {
            return (ScalarLiteral) value;
        } else if (value instanceof Boolean) {
            return of((boolean) (Boolean) value);
        } else if (value instanceof Long || value instanceof Integer ||
                   value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            return of(((Number) value).doubleValue());
        } else if (value instanceof String) {
            return of((String) value);
        } else if (value instanceof LocalDateTime) {
            return of((LocalDateTime) value);
        } else if (value instanceof LocalDate) {
            return of((LocalDate) value);
        } else if (value instanceof ZonedDateTime) {
            return of((ZonedDateTime) value);
        } else if (value instanceof OffsetDateTime) {
            return of((OffsetDateTime) value);
        } else if (value instanceof Instant) {
            return of((Instant) value);
        } else if (value instanceof Collection) {
            List<ScalarLiteral> elements = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                elements.add(from(element));
            }
            return array(elements);
        }
        throw new InvalidExpressionException(
            "'" + value + "' of type " + value.getClass().getSimpleName() + " is not a valid scalar",
            "ScalarLiteral", "scalar-type");
    }

    private static void checkHomogeneous(List<ScalarLiteral> elements) {
        Kind seen = null;
        for (ScalarLiteral element : elements) {
            Objects.requireNonNull(element, "array elements must not be null, use nullValue()");
            Kind kind = element.kind();
            if (kind == Kind.NULL) {
                continue;
            }
            if (seen == null) {
                seen = kind;
            } else if (seen != kind && !(seen.isNumeric() && kind.isNumeric())) {
                String shown = elements.toString();
                if (shown.length() > 20) {
                    shown = shown.substring(0, 20) + "...";
                }
                throw new InvalidExpressionException(
                    "invalid array " + shown + ": arrays must have the same data type or NULL, " +
                    "perhaps use a tuple instead", "ScalarLiteral", "homogeneous-array");
            }
        }
    }
}
