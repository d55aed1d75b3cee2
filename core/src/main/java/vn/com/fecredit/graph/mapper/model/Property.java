package vn.com.fecredit.graph.mapper.model;

/**
 * A target property of a vertex or edge and where its value comes from.
 */
public final class Property {
    private final String name;
    private final String jsonPath;
    private final String declaredType;
    private final NebulaType nebulaType;
    private final boolean optional;
    private final boolean indexable;
    private final int maxLength;
    private final String defaultValue;
    private final Transform transform;

    public Property(String name, String jsonPath, String declaredType, NebulaType nebulaType,
                    boolean optional, boolean indexable, int maxLength, String defaultValue,
                    Transform transform) {
        this.name = name;
        this.jsonPath = jsonPath;
        this.declaredType = declaredType == null ? nebulaType.name() : declaredType;
        this.nebulaType = nebulaType;
        this.optional = optional;
        this.indexable = indexable;
        this.maxLength = Math.max(0, maxLength);
        this.defaultValue = defaultValue;
        this.transform = transform;
    }

    public static Property of(String name, String jsonPath, NebulaType type) {
        return new Property(name, jsonPath, type.name(), type, false, false, 0, null, null);
    }

    public String getName() { return name; }

    /** Path relative to the vertex or edge source object. */
    public String getJsonPath() { return jsonPath; }

    /** Type name as written in the mapping, e.g. {@code varchar}. */
    public String getDeclaredType() { return declaredType; }

    public NebulaType getNebulaType() { return nebulaType; }

    public boolean isOptional() { return optional; }

    public boolean isIndexable() { return indexable; }

    /** 0 when the mapping did not set one. */
    public int getMaxLength() { return maxLength; }

    public String getDefaultValue() { return defaultValue; }

    public Transform getTransform() { return transform; }
}
