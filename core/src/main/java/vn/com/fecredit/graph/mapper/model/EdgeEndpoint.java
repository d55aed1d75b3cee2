package vn.com.fecredit.graph.mapper.model;

public final class EdgeEndpoint {
    private final String tag;
    private final String keyPath;

    public EdgeEndpoint(String tag, String keyPath) {
        this.tag = tag;
        this.keyPath = keyPath;
    }

    public String getTag() { return tag; }

    /** Path, relative to the edge source object, yielding the endpoint vertex id. */
    public String getKeyPath() { return keyPath; }
}
