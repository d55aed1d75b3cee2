package vn.com.fecredit.graph.mapper.json;

/**
 * One step of a slash path: an object key or an array index.
 */
public final class PathSegment {
    private final String key;
    private final int index;
    private final String text;

    private PathSegment(String key, int index, String text) {
        this.key = key;
        this.index = index;
        this.text = text;
    }

    public static PathSegment key(String key) {
        return new PathSegment(key, -1, key);
    }

    public static PathSegment index(int index, String text) {
        return new PathSegment(null, index, text);
    }

    public boolean isIndex() {
        return key == null;
    }

    public String getKey() { return key; }

    public int getIndex() { return index; }

    /** Segment as written in the path, e.g. {@code [0]}. */
    public String getText() { return text; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathSegment)) return false;
        PathSegment other = (PathSegment) o;
        return index == other.index && text.equals(other.text) && java.util.Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(key, index, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
