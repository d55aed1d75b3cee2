package vn.com.fecredit.graph.mapper.statement;

import vn.com.fecredit.graph.mapper.model.NebulaType;
import vn.com.fecredit.graph.mapper.transform.TransformValue;
import vn.com.fecredit.graph.mapper.util.IdentifierHelper;

/**
 * A typed value ready to be written into a statement.
 */
public final class PropertyValue {
    private final NebulaType type;
    private final Object payload;
    private final boolean isNull;

    private PropertyValue(NebulaType type, Object payload, boolean isNull) {
        this.type = type;
        this.payload = payload;
        this.isNull = isNull;
    }

    public static PropertyValue nullValue(NebulaType type) {
        return new PropertyValue(type, null, true);
    }

    public static PropertyValue of(NebulaType type, String value) {
        return new PropertyValue(type, value, false);
    }

    public static PropertyValue of(NebulaType type, long value) {
        return new PropertyValue(type, value, false);
    }

    public static PropertyValue of(NebulaType type, double value) {
        return new PropertyValue(type, value, false);
    }

    public static PropertyValue of(NebulaType type, boolean value) {
        return new PropertyValue(type, value, false);
    }

    public NebulaType getType() { return type; }

    public boolean isNull() { return isNull; }

    /**
     * Literal text: {@code NULL}, a quoted and escaped string, bare {@code true}/{@code false},
     * or plain decimal digits.
     */
    public String format() {
        if (isNull) return "NULL";
        if (payload instanceof String) return IdentifierHelper.quoteString((String) payload);
        if (payload instanceof Double) return TransformValue.formatDouble((Double) payload);
        return String.valueOf(payload);
    }

    @Override
    public String toString() {
        return format();
    }
}
