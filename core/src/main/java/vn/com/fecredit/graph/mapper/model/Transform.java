package vn.com.fecredit.graph.mapper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transform attached to a property. The function actually applied is looked up in the
 * transform registry when values are extracted, see {@link #functionName()}.
 */
public final class Transform {
    private final String name;
    private final TransformType type;
    private final String function;
    private final Map<String, String> params;
    private final List<TransformRule> rules;

    public Transform(String name, TransformType type, String function, Map<String, String> params,
                     List<TransformRule> rules) {
        this.name = name;
        this.type = type == null ? TransformType.NONE : type;
        this.function = function;
        this.params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static Transform function(String function, Map<String, String> params) {
        return new Transform(function, TransformType.CUSTOM, function, params, List.of());
    }

    public String getName() { return name; }

    public TransformType getType() { return type; }

    public String getFunction() { return function; }

    public Map<String, String> getParams() { return params; }

    public List<TransformRule> getRules() { return rules; }

    /**
     * Registry name to apply: explicit function, else {@code array_join} for ARRAY_JOIN,
     * else the transform's own name.
     */
    public String functionName() {
        if (function != null && !function.isBlank()) return function;
        if (type == TransformType.ARRAY_JOIN) return "array_join";
        return name;
    }
}
