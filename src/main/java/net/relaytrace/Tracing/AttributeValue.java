package net.relaytrace.Tracing;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A span attribute value. The set of types is closed: STRING, LONG, DOUBLE or BOOLEAN.
 * Anything else is converted to its string form by {@link #from(Object)}.
 */
@Getter
@EqualsAndHashCode
public final class AttributeValue {

    public enum Type {
        STRING,
        LONG,
        DOUBLE,
        BOOLEAN
    }

    private final Type type;
    private final Object value;

    private AttributeValue(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static AttributeValue of(String value) {
        return new AttributeValue(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static AttributeValue of(long value) {
        return new AttributeValue(Type.LONG, value);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(Type.DOUBLE, value);
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(Type.BOOLEAN, value);
    }

    /**
     * Converts an arbitrary non-null value. Integral numbers become LONG, floating point
     * numbers become DOUBLE, booleans stay BOOLEAN, everything else becomes STRING via
     * {@link String#valueOf(Object)}.
     *
     * @throws NullPointerException if {@code raw} is null; callers omit null-valued keys
     */
    public static AttributeValue from(Object raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw instanceof AttributeValue attributeValue) {
            return attributeValue;
        }
        if (raw instanceof Boolean bool) {
            return of(bool.booleanValue());
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte
                || raw instanceof AtomicInteger || raw instanceof AtomicLong) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            return of(((Number) raw).doubleValue());
        }
        if (raw instanceof BigInteger bigInteger && bigInteger.bitLength() < 64) {
            return of(bigInteger.longValue());
        }
        if (raw instanceof BigDecimal || raw instanceof BigInteger) {
            // precision beyond long/double is kept as text
            return of(raw.toString());
        }
        if (raw instanceof Enum<?> constant) {
            return of(constant.name());
        }
        return of(String.valueOf(raw));
    }

    public String asString() {
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
