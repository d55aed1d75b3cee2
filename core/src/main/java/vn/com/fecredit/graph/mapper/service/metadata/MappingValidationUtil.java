package vn.com.fecredit.graph.mapper.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import vn.com.fecredit.graph.mapper.model.NebulaType;
import vn.com.fecredit.graph.mapper.util.IdentifierHelper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a {@link MappingDefinition} before it is resolved.
 *
 * Validates:
 * - source paths, keys and endpoint tags are present
 * - tag, edge and property names are identifiers, property names unique per element
 * - declared types (and dynamic allowed types) resolve to a graph type
 * - settings are in range
 * Edges pointing at tags the mapping does not declare only produce warnings.
 */
public class MappingValidationUtil {

    public static final int MAX_STRING_LENGTH = 65535;

    /**
     * Validation result containing details about validation success/failure
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<String> errors;
        private final List<String> warnings;

        public ValidationResult(boolean valid, List<String> errors, List<String> warnings) {
            this.valid = valid;
            this.errors = errors != null ? errors : new ArrayList<>();
            this.warnings = warnings != null ? warnings : new ArrayList<>();
        }

        public boolean isValid() {
            return valid;
        }

        public List<String> getErrors() {
            return errors;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult{valid=").append(valid);
            if (!errors.isEmpty()) {
                sb.append(", errors=[");
                sb.append(String.join("; ", errors));
                sb.append("]");
            }
            if (!warnings.isEmpty()) {
                sb.append(", warnings=[");
                sb.append(String.join("; ", warnings));
                sb.append("]");
            }
            sb.append("}");
            return sb.toString();
        }
    }

    private MappingValidationUtil() {
    }

    public static ValidationResult validate(MappingDefinition def) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (def == null) {
            errors.add("Mapping definition is empty");
            return new ValidationResult(false, errors, warnings);
        }

        validateSettings(def.settings, errors);

        Map<String, MappingDefinition.TagDef> tags = def.tags == null ? Map.of() : def.tags;
        Map<String, MappingDefinition.EdgeDef> edges = def.edges == null ? Map.of() : def.edges;
        if (tags.isEmpty() && edges.isEmpty()) {
            warnings.add("Mapping declares no tags or edges");
        }

        for (Map.Entry<String, MappingDefinition.TagDef> e : tags.entrySet()) {
            String tag = e.getKey();
            MappingDefinition.TagDef t = e.getValue();
            checkIdentifier("tag", tag, errors);
            if (t == null) {
                errors.add("Tag definition is empty: " + tag);
                continue;
            }
            if (isBlank(t.from)) {
                errors.add("Source path cannot be empty: " + tag);
            }
            if (t.key != null && t.key.isBlank()) {
                errors.add("Key field cannot be empty: " + tag);
            }
            validateDynamicFields(tag, t.dynamicFields, errors);
            validateProperties(tag, t.properties, errors);
        }

        for (Map.Entry<String, MappingDefinition.EdgeDef> e : edges.entrySet()) {
            String edge = e.getKey();
            MappingDefinition.EdgeDef d = e.getValue();
            checkIdentifier("edge", edge, errors);
            if (d == null) {
                errors.add("Edge definition is empty: " + edge);
                continue;
            }
            if (isBlank(d.from)) {
                errors.add("Source path cannot be empty: " + edge);
            }
            validateEndpoint(edge, "Source", d.sourceTag, tags, errors, warnings);
            validateEndpoint(edge, "Target", d.targetTag, tags, errors, warnings);
            if (d.sourceKey != null && d.sourceKey.isBlank()) {
                errors.add("Key field cannot be empty: " + edge + ".source_key");
            }
            if (d.targetKey != null && d.targetKey.isBlank()) {
                errors.add("Key field cannot be empty: " + edge + ".target_key");
            }
            validateProperties(edge, d.properties, errors);
        }

        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    private static void validateSettings(MappingDefinition.SettingsDef s, List<String> errors) {
        if (s == null) return;
        if (s.stringLength != null && (s.stringLength <= 0 || s.stringLength > MAX_STRING_LENGTH)) {
            errors.add("Invalid string_length: " + s.stringLength);
        }
        if (s.arrayDelimiter != null && s.arrayDelimiter.isEmpty()) {
            errors.add("array_delimiter cannot be empty");
        }
    }

    private static void validateEndpoint(String edge, String side, String tag,
                                         Map<String, MappingDefinition.TagDef> tags,
                                         List<String> errors, List<String> warnings) {
        if (isBlank(tag)) {
            errors.add(side + " tag cannot be empty: " + edge);
        } else if (!IdentifierHelper.isSimpleIdentifier(tag)) {
            errors.add("Invalid " + side.toLowerCase() + " tag identifier: " + tag);
        } else if (!tags.containsKey(tag)) {
            warnings.add("Edge " + edge + " references undeclared tag: " + tag);
        }
    }

    private static void validateDynamicFields(String tag, JsonNode node, List<String> errors) {
        if (node == null || node.isNull() || node.isBoolean()) return;
        if (!node.isObject()) {
            errors.add("dynamic_fields must be a boolean or a map: " + tag);
            return;
        }
        for (JsonNode t : node.path("allowed_types")) {
            if (NebulaType.lookup(t.asText()).isEmpty()) {
                errors.add("Invalid dynamic field type: " + t.asText());
            }
        }
        for (JsonNode p : node.path("excluded_properties")) {
            if (!IdentifierHelper.isSimpleIdentifier(p.asText())) {
                errors.add("Invalid excluded property name: " + p.asText());
            }
        }
    }

    private static void validateProperties(String element, List<MappingDefinition.PropertyDef> props,
                                           List<String> errors) {
        if (props == null) return;
        Set<String> seen = new HashSet<>();
        for (MappingDefinition.PropertyDef p : props) {
            if (p == null) {
                errors.add("Property definition is empty: " + element);
                continue;
            }
            if (isBlank(p.json)) {
                errors.add("Property path cannot be empty: " + element);
                continue;
            }
            String name = isBlank(p.name) ? IdentifierHelper.deriveName(p.json) : p.name;
            if (!IdentifierHelper.isSimpleIdentifier(name)) {
                errors.add("Invalid property name: " + name
                        + ". Must start with letter or underscore and contain only alphanumeric characters.");
            } else if (!seen.add(name)) {
                errors.add("Duplicate property name: " + element + "." + name);
            }
            boolean hasTransform = p.transform != null && !p.transform.isNull();
            if (!isBlank(p.type)) {
                if (NebulaType.lookup(p.type).isEmpty()) {
                    errors.add("Invalid property type: " + p.type
                            + ". Must be one of the valid Nebula Graph types.");
                }
            } else if (!hasTransform) {
                errors.add("Property type is required: " + element + "." + name);
            }
            if (p.maxLength != null && (p.maxLength < 0 || p.maxLength > MAX_STRING_LENGTH)) {
                errors.add("Invalid max_length for " + element + "." + name + ": " + p.maxLength);
            }
            if (hasTransform) {
                validateRules(element, p.transform, errors);
            }
        }
    }

    private static void validateRules(String element, JsonNode transform, List<String> errors) {
        JsonNode rules = transform.isArray() ? transform : transform.path("rules");
        for (JsonNode r : rules) {
            String name = r.path("name").asText("");
            if (!IdentifierHelper.isSimpleIdentifier(name)) {
                errors.add("Invalid transform rule name: " + element + "." + name);
            }
            String type = r.path("type").asText("");
            if (!type.isEmpty() && NebulaType.lookup(type).isEmpty()) {
                errors.add("Invalid transform rule type: " + type);
            }
        }
    }

    private static void checkIdentifier(String what, String name, List<String> errors) {
        if (!IdentifierHelper.isSimpleIdentifier(name)) {
            errors.add("Invalid " + what + " name: " + name);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
