package vn.com.fecredit.graph.mapper.service;

/**
 * Column of a CREATE TAG / CREATE EDGE statement. {@code type} is already rendered,
 * e.g. {@code STRING(256)}.
 */
public class SchemaProperty {
    private final String name;
    private final String type;
    private final boolean nullable;
    private final String defaultValue;
    private final Integer fixedLength;
    private final boolean indexable;

    public SchemaProperty(String name, String type, boolean nullable, String defaultValue,
                          Integer fixedLength, boolean indexable) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
        this.defaultValue = defaultValue;
        this.fixedLength = fixedLength;
        this.indexable = indexable;
    }

    public String getName() { return name; }

    public String getType() { return type; }

    public boolean isNullable() { return nullable; }

    /** Literal as it goes into the DDL, already quoted when needed. */
    public String getDefaultValue() { return defaultValue; }

    /** Length of string-typed columns, null otherwise. */
    public Integer getFixedLength() { return fixedLength; }

    public boolean isIndexable() { return indexable; }
}
