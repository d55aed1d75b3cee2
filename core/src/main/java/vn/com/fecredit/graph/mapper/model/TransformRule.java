package vn.com.fecredit.graph.mapper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One rule of a rule-based transform, e.g. {@code strength_taste: BOOL when id=5}.
 */
public final class TransformRule {
    private final String name;
    private final String type;
    private final String condition;
    private final String value;
    private final String field;
    private final Map<String, String> mappings;

    public TransformRule(String name, String type, String condition, String value, String field,
                         Map<String, String> mappings) {
        this.name = name;
        this.type = type;
        this.condition = condition;
        this.value = value;
        this.field = field;
        this.mappings = mappings == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
    }

    public String getName() { return name; }

    public String getType() { return type; }

    public String getCondition() { return condition; }

    public String getValue() { return value; }

    public String getField() { return field; }

    /** value to property name */
    public Map<String, String> getMappings() { return mappings; }
}
