package vn.com.fecredit.graph.mapper.model;

import java.util.List;

public final class VertexMapping {
    private final String tagName;
    private final String sourcePath;
    private final String keyPath;
    private final List<Property> properties;
    private final DynamicFieldsConfig dynamicFields;

    public VertexMapping(String tagName, String sourcePath, String keyPath, List<Property> properties,
                         DynamicFieldsConfig dynamicFields) {
        this.tagName = tagName;
        this.sourcePath = sourcePath;
        this.keyPath = keyPath;
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.dynamicFields = dynamicFields == null ? DynamicFieldsConfig.DISABLED : dynamicFields;
    }

    public String getTagName() { return tagName; }

    /** Selects one object or an array of objects in the document. */
    public String getSourcePath() { return sourcePath; }

    public String getKeyPath() { return keyPath; }

    public List<Property> getProperties() { return properties; }

    public DynamicFieldsConfig getDynamicFields() { return dynamicFields; }
}
