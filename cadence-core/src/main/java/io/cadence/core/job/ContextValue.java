package io.cadence.core.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.cadence.core.ValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Scalar bound into a job's context: a string, a number or a boolean. Integral numbers are held as
 * {@code Long}, fractional ones as {@code Double}.
 */
public final class ContextValue {
    private static final Pattern INTEGER = Pattern.compile("^-?(0|[1-9]\\d{0,17})$");
    private static final Pattern DECIMAL = Pattern.compile("^-?(0|[1-9]\\d*)\\.\\d+$");

    private final Object value;

    private ContextValue(Object value) {
        this.value = value;
    }

    public static ContextValue of(String value) {
        return new ContextValue(Objects.requireNonNull(value, "value must not be null"));
    }

    public static ContextValue of(boolean value) {
        return new ContextValue(value);
    }

    public static ContextValue of(long value) {
        return new ContextValue(value);
    }

    public static ContextValue of(double value) {
        return new ContextValue(value);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ContextValue from(Object raw) {
        if (raw instanceof String s) {
            return of(s);
        }
        if (raw instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            try {
                return of(big.longValueExact());
            } catch (ArithmeticException e) {
                throw new ValidationException("context number out of range: " + big);
            }
        }
        if (raw instanceof Number number) {
            return of(number.doubleValue());
        }
        throw new ValidationException("context values must be strings, numbers or booleans, got: "
            + (raw == null ? "null" : raw.getClass().getSimpleName()));
    }

    /**
     * Interprets command-line text: {@code true}/{@code false}, integers and decimals become typed
     * values, anything else stays a string. Numbers with a leading zero such as {@code 007} stay
     * strings.
     */
    public static ContextValue parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String trimmed = text.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return of(Boolean.parseBoolean(lower));
        }
        if (INTEGER.matcher(trimmed).matches()) {
            return of(Long.parseLong(trimmed));
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return of(Double.parseDouble(trimmed));
        }
        return of(text);
    }

    @JsonValue
    public Object value() {
        return value;
    }

    public String asString() {
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return d.toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContextValue other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return asString();
    }
}
