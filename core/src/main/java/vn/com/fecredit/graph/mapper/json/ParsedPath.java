package vn.com.fecredit.graph.mapper.json;

import com.jayway.jsonpath.JsonPath;

import java.util.ArrayList;
import java.util.List;

/**
 * A path string parsed once: either a list of slash segments or a compiled JsonPath
 * expression (paths starting with {@code $}).
 */
public final class ParsedPath {
    private final String source;
    private final List<PathSegment> segments;
    private final JsonPath jsonPath;

    private ParsedPath(String source, List<PathSegment> segments, JsonPath jsonPath) {
        this.source = source;
        this.segments = segments;
        this.jsonPath = jsonPath;
    }

    public static ParsedPath parse(String path) {
        String p = path == null ? "" : path.trim();
        if (p.startsWith("$")) {
            return new ParsedPath(p, List.of(), JsonPath.compile(p));
        }
        return new ParsedPath(p, List.copyOf(segment(p)), null);
    }

    static List<PathSegment> segment(String path) {
        List<PathSegment> out = new ArrayList<>();
        String p = path.startsWith("/") ? path.substring(1) : path;
        for (String part : p.split("/")) {
            if (part.isEmpty()) continue;
            int pos = 0;
            while (pos < part.length()) {
                int open = part.indexOf('[', pos);
                if (open < 0) {
                    out.add(PathSegment.key(part.substring(pos)));
                    break;
                }
                int close = part.indexOf(']', open);
                if (close < 0) {
                    // unbalanced bracket, keep the rest as a literal key
                    out.add(PathSegment.key(part.substring(pos)));
                    break;
                }
                if (open > pos) out.add(PathSegment.key(part.substring(pos, open)));
                out.add(bracket(part.substring(open, close + 1)));
                pos = close + 1;
            }
        }
        return out;
    }

    private static PathSegment bracket(String text) {
        String inner = text.substring(1, text.length() - 1);
        if (!inner.isEmpty() && inner.chars().allMatch(Character::isDigit)) {
            try {
                return PathSegment.index(Integer.parseInt(inner), text);
            } catch (NumberFormatException e) {
                // too large for an int, can never be in bounds
                return PathSegment.index(Integer.MAX_VALUE, text);
            }
        }
        return PathSegment.key(text);
    }

    public String getSource() { return source; }

    public List<PathSegment> getSegments() { return segments; }

    public boolean isJsonPath() { return jsonPath != null; }

    public JsonPath getJsonPath() { return jsonPath; }
}
