package vn.com.fecredit.graph.mapper.transform;

import vn.com.fecredit.graph.mapper.exception.TransformException;
import vn.com.fecredit.graph.mapper.model.NebulaType;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Scalar flowing through a transform: a String, Long, Double or Boolean, tagged with the
 * graph type it is meant to be written as.
 */
public final class TransformValue {
    private final Object value;
    private final NebulaType targetType;

    private TransformValue(Object value, NebulaType targetType) {
        this.value = Objects.requireNonNull(value, "value");
        this.targetType = targetType;
    }

    public static TransformValue of(String value) {
        return new TransformValue(value, NebulaType.STRING);
    }

    public static TransformValue of(long value) {
        return new TransformValue(value, NebulaType.INT64);
    }

    public static TransformValue of(double value) {
        return new TransformValue(value, NebulaType.DOUBLE);
    }

    public static TransformValue of(boolean value) {
        return new TransformValue(value, NebulaType.BOOL);
    }

    public TransformValue withTargetType(NebulaType type) {
        return new TransformValue(value, type);
    }

    public Object getValue() { return value; }

    public NebulaType getTargetType() { return targetType; }

    /**
     * Coerce the payload to {@code type}. Matching payloads are returned as is, numbers and
     * booleans stringify, and numeric strings parse.
     *
     * @throws TransformException when no conversion applies
     */
    public <T> T as(Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        if (type == String.class) {
            return type.cast(asText());
        }
        try {
            if (type == Long.class) {
                if (value instanceof String) return type.cast(Long.parseLong(((String) value).trim()));
            } else if (type == Double.class) {
                if (value instanceof Long) return type.cast(((Long) value).doubleValue());
                if (value instanceof String) return type.cast(Double.parseDouble(((String) value).trim()));
            }
        } catch (NumberFormatException e) {
            throw new TransformException("Cannot convert value to requested type", asText(), e);
        }
        throw new TransformException("Cannot convert value to requested type", asText());
    }

    private String asText() {
        if (value instanceof Double) {
            return formatDouble((Double) value);
        }
        return String.valueOf(value);
    }

    /** Plain decimal text, no exponent and no trailing zeros ({@code 3.5}, {@code 2}). */
    public static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == 0.0d) return "0";
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransformValue)) return false;
        TransformValue other = (TransformValue) o;
        return value.equals(other.value) && targetType == other.targetType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, targetType);
    }

    @Override
    public String toString() {
        return targetType + ":" + asText();
    }
}
