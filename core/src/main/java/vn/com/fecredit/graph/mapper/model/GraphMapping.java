package vn.com.fecredit.graph.mapper.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved mapping: which vertices and edges to produce from a document.
 * Immutable once built by {@link vn.com.fecredit.graph.mapper.service.MappingFactory}.
 */
public final class GraphMapping {
    private final List<VertexMapping> vertices;
    private final List<EdgeMapping> edges;
    private final Map<String, Transform> transforms;
    private final MappingSettings settings;

    public GraphMapping(List<VertexMapping> vertices, List<EdgeMapping> edges,
                        Map<String, Transform> transforms, MappingSettings settings) {
        this.vertices = vertices == null ? List.of() : List.copyOf(vertices);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
        this.transforms = transforms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(transforms));
        this.settings = settings == null ? MappingSettings.DEFAULTS : settings;
    }

    public List<VertexMapping> getVertices() { return vertices; }

    public List<EdgeMapping> getEdges() { return edges; }

    public Map<String, Transform> getTransforms() { return transforms; }

    public MappingSettings getSettings() { return settings; }
}
