package vn.com.fecredit.graph.mapper.service;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class SchemaElement {
    private final String name;
    private final boolean edge;
    private final List<SchemaProperty> properties;
    private final Set<String> fromTags;
    private final Set<String> toTags;

    public SchemaElement(String name, boolean edge, List<SchemaProperty> properties,
                         Set<String> fromTags, Set<String> toTags) {
        this.name = name;
        this.edge = edge;
        this.properties = properties == null ? List.of() : List.copyOf(properties);
        this.fromTags = fromTags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(fromTags));
        this.toTags = toTags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(toTags));
    }

    public static SchemaElement tag(String name, List<SchemaProperty> properties) {
        return new SchemaElement(name, false, properties, null, null);
    }

    public String getName() { return name; }

    public boolean isEdge() { return edge; }

    public List<SchemaProperty> getProperties() { return properties; }

    /** Source tags an edge may start from; empty for tags. */
    public Set<String> getFromTags() { return fromTags; }

    public Set<String> getToTags() { return toTags; }

    String keyword() {
        return edge ? "EDGE" : "TAG";
    }
}
