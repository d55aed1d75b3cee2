package vn.com.fecredit.graph.mapper.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.exception.MappingConfigException;
import vn.com.fecredit.graph.mapper.model.DynamicFieldsConfig;
import vn.com.fecredit.graph.mapper.model.EdgeEndpoint;
import vn.com.fecredit.graph.mapper.model.EdgeMapping;
import vn.com.fecredit.graph.mapper.model.GraphMapping;
import vn.com.fecredit.graph.mapper.model.MappingSettings;
import vn.com.fecredit.graph.mapper.model.NebulaType;
import vn.com.fecredit.graph.mapper.model.Property;
import vn.com.fecredit.graph.mapper.model.Transform;
import vn.com.fecredit.graph.mapper.model.TransformRule;
import vn.com.fecredit.graph.mapper.model.TransformType;
import vn.com.fecredit.graph.mapper.model.VertexMapping;
import vn.com.fecredit.graph.mapper.service.metadata.MappingDefinition;
import vn.com.fecredit.graph.mapper.service.metadata.MappingValidationUtil;
import vn.com.fecredit.graph.mapper.service.metadata.MappingValidationUtil.ValidationResult;
import vn.com.fecredit.graph.mapper.transform.BuiltinTransforms;
import vn.com.fecredit.graph.mapper.util.IdentifierHelper;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a validated {@link MappingDefinition} into an immutable {@link GraphMapping}.
 *
 * <p>Paths written in dotted form ({@code level.nowLevel}, {@code comment.list[*]}) are
 * rewritten to JsonPath expressions; slash paths and {@code $} expressions are kept as is.
 * Rule-list transforms expand into one property per rule.</p>
 */
public class MappingFactory {

    private static final Logger log = LoggerFactory.getLogger(MappingFactory.class);

    public static final String DEFAULT_KEY = "id";

    public GraphMapping create(MappingDefinition def) {
        ValidationResult result = MappingValidationUtil.validate(def);
        for (String w : result.getWarnings()) {
            log.warn("Mapping warning: {}", w);
        }
        if (!result.isValid()) {
            throw new MappingConfigException("Invalid mapping: " + String.join("; ", result.getErrors()));
        }

        MappingSettings settings = settings(def.settings);
        Map<String, Transform> named = new LinkedHashMap<>();
        if (def.transforms != null) {
            for (Map.Entry<String, JsonNode> e : def.transforms.entrySet()) {
                Transform t = parseTransform(e.getKey(), e.getValue(), named, settings);
                if (t != null) named.put(e.getKey(), t);
            }
        }

        List<VertexMapping> vertices = new ArrayList<>();
        if (def.tags != null) {
            for (Map.Entry<String, MappingDefinition.TagDef> e : def.tags.entrySet()) {
                MappingDefinition.TagDef t = e.getValue();
                String key = t.key == null ? DEFAULT_KEY : t.key;
                vertices.add(new VertexMapping(e.getKey(), normalizePath(t.from), normalizePath(key),
                        properties(e.getKey(), t.properties, named, settings), dynamicFields(t.dynamicFields)));
            }
        }

        List<EdgeMapping> edges = new ArrayList<>();
        if (def.edges != null) {
            for (Map.Entry<String, MappingDefinition.EdgeDef> e : def.edges.entrySet()) {
                MappingDefinition.EdgeDef d = e.getValue();
                EdgeEndpoint from = new EdgeEndpoint(d.sourceTag,
                        normalizePath(d.sourceKey == null ? DEFAULT_KEY : d.sourceKey));
                EdgeEndpoint to = new EdgeEndpoint(d.targetTag,
                        normalizePath(d.targetKey == null ? DEFAULT_KEY : d.targetKey));
                edges.add(new EdgeMapping(e.getKey(), normalizePath(d.from), from, to,
                        properties(e.getKey(), d.properties, named, settings)));
            }
        }

        log.debug("Built mapping with {} tags, {} edges, {} named transforms",
                vertices.size(), edges.size(), named.size());
        return new GraphMapping(vertices, edges, named, settings);
    }

    /**
     * Dotted paths and paths containing {@code [*]} become JsonPath ({@code $.a.b});
     * anything else is left for slash navigation.
     */
    static String normalizePath(String path) {
        if (path == null) return "";
        String p = path.trim();
        if (p.isEmpty() || p.startsWith("$") || p.startsWith("/")) return p;
        if (p.contains(".") || p.contains("[*]")) {
            return "$." + p;
        }
        return p;
    }

    private static MappingSettings settings(MappingDefinition.SettingsDef s) {
        if (s == null) return MappingSettings.DEFAULTS;
        return new MappingSettings(
                s.stringLength == null ? MappingSettings.DEFAULT_STRING_LENGTH : s.stringLength,
                s.arrayDelimiter,
                Boolean.TRUE.equals(s.dynamicTags));
    }

    private List<Property> properties(String element, List<MappingDefinition.PropertyDef> defs,
                                      Map<String, Transform> named, MappingSettings settings) {
        List<Property> out = new ArrayList<>();
        if (defs == null) return out;
        Set<String> seen = new HashSet<>();
        for (MappingDefinition.PropertyDef d : defs) {
            for (Property p : property(element, d, named, settings)) {
                if (!seen.add(p.getName())) {
                    throw new MappingConfigException("Duplicate property name: " + element + "." + p.getName(), element);
                }
                out.add(p);
            }
        }
        return out;
    }

    private List<Property> property(String element, MappingDefinition.PropertyDef d,
                                    Map<String, Transform> named, MappingSettings settings) {
        String path = normalizePath(d.json);
        String name = d.name == null || d.name.isBlank() ? IdentifierHelper.deriveName(d.json) : d.name;
        boolean optional = Boolean.TRUE.equals(d.optional);
        int maxLength = d.maxLength == null ? 0 : d.maxLength;
        Transform transform = d.transform == null || d.transform.isNull()
                ? null : parseTransform(name, d.transform, named, settings);

        if (transform != null && isRuleTransform(transform)) {
            return expandRules(element, name, path, optional, d.isIndexed(), transform);
        }

        String declared = d.type;
        if (declared == null || declared.isBlank()) {
            declared = transform != null && !transform.getRules().isEmpty()
                    && transform.getRules().get(0).getType() != null
                    ? transform.getRules().get(0).getType() : NebulaType.STRING.name();
        }
        NebulaType type = NebulaType.lookup(declared).orElseThrow(() ->
                new MappingConfigException("Invalid property type: " + d.type, element + "." + name));
        return List.of(new Property(name, path, declared, type, optional, d.isIndexed(), maxLength,
                d.defaultValue, transform));
    }

    private static boolean isRuleTransform(Transform t) {
        if (t.getType() == TransformType.ARRAY_TO_BOOL) return true;
        return t.getType() == TransformType.CUSTOM && !t.getRules().isEmpty()
                && (t.getFunction() == null || t.getFunction().isBlank());
    }

    // one BOOL (or rule-typed) property per rule, all reading the same source path
    private List<Property> expandRules(String element, String name, String path, boolean optional,
                                       boolean indexed, Transform transform) {
        List<TransformRule> rules = transform.getRules();
        if (rules.isEmpty()) {
            String condition = transform.getParams().get("condition");
            if (condition == null || condition.isBlank()) {
                throw new MappingConfigException("ARRAY_TO_BOOL transform needs rules or a condition",
                        element + "." + name);
            }
            rules = List.of(new TransformRule(name, NebulaType.BOOL.name(), condition, null, null, null));
        }
        List<Property> out = new ArrayList<>();
        for (TransformRule r : rules) {
            String declared = r.getType() == null || r.getType().isBlank() ? NebulaType.BOOL.name() : r.getType();
            NebulaType type = NebulaType.lookup(declared).orElseThrow(() ->
                    new MappingConfigException("Invalid transform rule type: " + r.getType(), element + "." + r.getName()));
            Transform single = new Transform(r.getName(), TransformType.ARRAY_TO_BOOL, null,
                    transform.getParams(), List.of(r));
            out.add(new Property(r.getName(), path, declared, type, optional, indexed, 0, null, single));
        }
        return out;
    }

    Transform parseTransform(String owner, JsonNode node, Map<String, Transform> named, MappingSettings settings) {
        if (node.isTextual()) {
            String n = node.asText().trim();
            if (named.containsKey(n)) return named.get(n);
            TransformType type = TransformType.fromName(n);
            if (type == TransformType.NONE) return null;
            if (type == TransformType.ARRAY_JOIN) {
                return withDefaultDelimiter(new Transform(n, type, null, Map.of(), List.of()), settings);
            }
            return withDefaultDelimiter(new Transform(n, TransformType.CUSTOM, n, Map.of(), List.of()), settings);
        }
        if (node.isArray()) {
            return new Transform(owner, TransformType.CUSTOM, null, Map.of(), rules(node));
        }
        if (!node.isObject()) {
            throw new MappingConfigException("Transform must be a name, a map or a list of rules", owner);
        }

        String ref = text(node, "name");
        if (ref != null && named.containsKey(ref) && !node.has("function") && !node.has("type")) {
            return named.get(ref);
        }
        String function = text(node, "function");
        String typeText = text(node, "type");
        List<TransformRule> rules = rules(node.path("rules"));
        TransformType type;
        if (typeText != null) {
            type = TransformType.fromName(typeText);
            // "type: time_format" names a registry function directly
            if (type == TransformType.CUSTOM && function == null && !"CUSTOM".equals(typeText.toUpperCase(Locale.ROOT))) {
                function = typeText;
            }
        } else {
            type = function != null || !rules.isEmpty() ? TransformType.CUSTOM : TransformType.NONE;
        }
        if (type == TransformType.NONE && function == null) {
            return null;
        }

        Map<String, String> params = new LinkedHashMap<>();
        JsonNode p = node.path("params");
        for (Iterator<Map.Entry<String, JsonNode>> it = p.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            params.put(e.getKey(), e.getValue().asText());
        }
        for (String shorthand : List.of("delimiter", "format", "condition")) {
            String v = text(node, shorthand);
            if (v != null) params.putIfAbsent(shorthand, v);
        }
        return withDefaultDelimiter(new Transform(ref == null ? owner : ref, type, function, params, rules), settings);
    }

    private static Transform withDefaultDelimiter(Transform t, MappingSettings settings) {
        if (!BuiltinTransforms.ARRAY_JOIN.equals(t.functionName()) || t.getParams().containsKey("delimiter")) {
            return t;
        }
        Map<String, String> params = new LinkedHashMap<>(t.getParams());
        params.put("delimiter", settings.getArrayDelimiter());
        return new Transform(t.getName(), t.getType(), t.getFunction(), params, t.getRules());
    }

    private static List<TransformRule> rules(JsonNode node) {
        List<TransformRule> out = new ArrayList<>();
        for (JsonNode r : node) {
            Map<String, String> mappings = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = r.path("mappings").fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> e = it.next();
                mappings.put(e.getKey(), e.getValue().asText());
            }
            out.add(new TransformRule(text(r, "name"), text(r, "type"), text(r, "condition"),
                    text(r, "value"), text(r, "field"), mappings));
        }
        return out;
    }

    private static DynamicFieldsConfig dynamicFields(JsonNode node) {
        if (node == null || node.isNull()) return DynamicFieldsConfig.DISABLED;
        if (node.isBoolean()) {
            return node.asBoolean() ? DynamicFieldsConfig.enabled() : DynamicFieldsConfig.DISABLED;
        }
        Set<NebulaType> allowed = EnumSet.noneOf(NebulaType.class);
        for (JsonNode t : node.path("allowed_types")) {
            NebulaType.lookup(t.asText()).ifPresent(allowed::add);
        }
        Set<String> excluded = new LinkedHashSet<>();
        for (JsonNode e : node.path("excluded_properties")) {
            excluded.add(e.asText());
        }
        return new DynamicFieldsConfig(node.path("enabled").asBoolean(false), allowed, excluded);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() || v.isContainerNode() ? null : v.asText();
    }
}
