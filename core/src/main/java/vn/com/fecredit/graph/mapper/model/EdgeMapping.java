package vn.com.fecredit.graph.mapper.model;

import java.util.List;

public final class EdgeMapping {
    private final String edgeName;
    private final String sourcePath;
    private final EdgeEndpoint from;
    private final EdgeEndpoint to;
    private final List<Property> properties;

    public EdgeMapping(String edgeName, String sourcePath, EdgeEndpoint from, EdgeEndpoint to,
                       List<Property> properties) {
        this.edgeName = edgeName;
        this.sourcePath = sourcePath;
        this.from = from;
        this.to = to;
        this.properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public String getEdgeName() { return edgeName; }

    public String getSourcePath() { return sourcePath; }

    public EdgeEndpoint getFrom() { return from; }

    public EdgeEndpoint getTo() { return to; }

    public List<Property> getProperties() { return properties; }
}
