package vn.com.fecredit.graph.mapper.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.PathNotFoundException;
import com.jayway.jsonpath.spi.json.JacksonJsonNodeJsonProvider;
import com.jayway.jsonpath.spi.mapper.JacksonMappingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.exception.DataExtractionException;
import vn.com.fecredit.graph.mapper.exception.PathResolutionException;
import vn.com.fecredit.graph.mapper.exception.PathResolutionException.Reason;

/**
 * Resolves slash paths ({@code /a/list[0]/b}) and JsonPath expressions ({@code $.a.list[*]})
 * against Jackson trees.
 *
 * <p>Parsed paths are memoized per path string for the lifetime of the navigator. The cache is
 * safe for concurrent use; a path is parsed at most once even when several threads miss at
 * the same time.</p>
 */
public class JsonPathNavigator {

    private static final Logger log = LoggerFactory.getLogger(JsonPathNavigator.class);

    private final ObjectMapper objectMapper;
    private final Configuration jsonPathConfig;
    private final Cache<String, ParsedPath> pathCache;

    public JsonPathNavigator() {
        this(new ObjectMapper());
    }

    public JsonPathNavigator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.jsonPathConfig = Configuration.builder()
                .jsonProvider(new JacksonJsonNodeJsonProvider(objectMapper))
                .mappingProvider(new JacksonMappingProvider(objectMapper))
                .build();
        this.pathCache = Caffeine.newBuilder().build();
    }

    /**
     * Resolve {@code path} against {@code document}. Empty path and {@code /} yield the root.
     *
     * @throws PathResolutionException when a key is missing or a node has the wrong shape
     */
    public JsonNode resolve(JsonNode document, String path) {
        ParsedPath parsed = parsed(path);
        if (parsed.isJsonPath()) {
            return evaluate(document, parsed);
        }
        JsonNode current = document;
        for (PathSegment seg : parsed.getSegments()) {
            if (seg.isIndex()) {
                if (current == null || !current.isArray()) {
                    throw new PathResolutionException(Reason.TYPE_MISMATCH,
                            "Expected array at path segment: " + seg.getText(), path);
                }
                if (seg.getIndex() >= current.size()) {
                    throw new PathResolutionException(Reason.TYPE_MISMATCH,
                            "Array index out of bounds: " + seg.getText(), path);
                }
                current = current.get(seg.getIndex());
            } else {
                if (current == null || !current.isObject()) {
                    throw new PathResolutionException(Reason.TYPE_MISMATCH,
                            "Expected object at path segment: " + seg.getText(), path);
                }
                if (!current.has(seg.getKey())) {
                    throw new PathResolutionException(Reason.NOT_FOUND,
                            "Property not found: " + seg.getText(), path);
                }
                current = current.get(seg.getKey());
            }
        }
        return current;
    }

    /**
     * Resolve and convert strictly: the JSON kind must match the requested type
     * (numbers for Long/Integer/Double, booleans for Boolean, text for String).
     */
    public <T> T resolveAs(JsonNode document, String path, Class<T> type) {
        JsonNode node = resolve(document, path);
        Object value;
        if (type == JsonNode.class) {
            value = node;
        } else if (type == String.class && node.isTextual()) {
            value = node.textValue();
        } else if (type == Long.class && node.isIntegralNumber() && node.canConvertToLong()) {
            value = node.longValue();
        } else if (type == Integer.class && node.isIntegralNumber() && node.canConvertToInt()) {
            value = node.intValue();
        } else if (type == Double.class && node.isNumber()) {
            value = node.doubleValue();
        } else if (type == Boolean.class && node.isBoolean()) {
            value = node.booleanValue();
        } else {
            throw new PathResolutionException(Reason.TYPE_MISMATCH, "Type conversion failed", path);
        }
        return type.cast(value);
    }

    /**
     * Lenient variant of {@link #resolveAs}: any resolution or conversion failure yields
     * {@code defaultValue}.
     */
    public <T> T resolveOrDefault(JsonNode document, String path, Class<T> type, T defaultValue) {
        try {
            return resolveAs(document, path, type);
        } catch (DataExtractionException e) {
            log.trace("Using default for {}: {}", path, e.getMessage());
            return defaultValue;
        }
    }

    public boolean hasPath(JsonNode document, String path) {
        try {
            resolve(document, path);
            return true;
        } catch (DataExtractionException e) {
            return false;
        }
    }

    public void clearCache() {
        pathCache.invalidateAll();
    }

    public int cacheSize() {
        return pathCache.asMap().size();
    }

    ParsedPath parsed(String path) {
        String key = path == null ? "" : path;
        return pathCache.get(key, k -> {
            log.debug("Parsing path {}", k);
            try {
                return ParsedPath.parse(k);
            } catch (InvalidPathException e) {
                throw new DataExtractionException("Invalid JSON path expression: " + e.getMessage(), k, e);
            }
        });
    }

    private JsonNode evaluate(JsonNode document, ParsedPath parsed) {
        try {
            Object result = parsed.getJsonPath().read(document, jsonPathConfig);
            if (result == null) {
                return objectMapper.nullNode();
            }
            if (result instanceof JsonNode) {
                JsonNode n = (JsonNode) result;
                return n instanceof MissingNode ? objectMapper.nullNode() : n;
            }
            // scalar leaves come back unwrapped from the Jackson provider
            return objectMapper.valueToTree(result);
        } catch (PathNotFoundException e) {
            throw new PathResolutionException(Reason.NOT_FOUND,
                    "Property not found: " + e.getMessage(), parsed.getSource());
        } catch (InvalidPathException e) {
            throw new DataExtractionException("Invalid JSON path expression: " + e.getMessage(),
                    parsed.getSource(), e);
        }
    }
}
