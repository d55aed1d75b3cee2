package vn.com.fecredit.graph.mapper.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.exception.TransformException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named value transforms. A new engine already knows the built-ins
 * ({@code time_format}, {@code price_normalize}, {@code string_normalize},
 * {@code array_join}, {@code to_boolean}); callers may register more before use.
 */
public class TransformEngine {

    private static final Logger log = LoggerFactory.getLogger(TransformEngine.class);

    private final Map<String, TransformFunction> functions = new ConcurrentHashMap<>();

    public TransformEngine() {
        BuiltinTransforms.registerAll(this);
    }

    /** Registers or replaces {@code name}. */
    public void register(String name, TransformFunction function) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Transform name must not be blank");
        }
        if (function == null) {
            throw new IllegalArgumentException("Transform function must not be null");
        }
        if (functions.put(name, function) != null) {
            log.debug("Replaced transform {}", name);
        }
    }

    public TransformValue apply(String name, TransformValue value, Map<String, String> params) {
        TransformFunction fn = name == null ? null : functions.get(name);
        if (fn == null) {
            throw new TransformException("Transform not found: " + name);
        }
        return fn.apply(value, params == null ? Map.of() : params);
    }

    public boolean hasTransform(String name) {
        return name != null && functions.containsKey(name);
    }

    public Set<String> registeredNames() {
        return new TreeSet<>(functions.keySet());
    }
}
