package vn.com.fecredit.graph.mapper.statement;

import com.fasterxml.jackson.databind.JsonNode;
import vn.com.fecredit.graph.mapper.model.DynamicFieldsConfig;
import vn.com.fecredit.graph.mapper.model.NebulaType;
import vn.com.fecredit.graph.mapper.model.Property;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the scalar keys of a record that the mapping does not declare, for tags with
 * dynamic fields enabled.
 */
public class DynamicPropertyHelper {

    /**
     * @return extra properties in document order, keyed by name
     */
    public Map<String, PropertyValue> extraProperties(JsonNode record, List<Property> declared,
                                                      DynamicFieldsConfig config) {
        Map<String, PropertyValue> out = new LinkedHashMap<>();
        if (!config.isEnabled() || record == null || !record.isObject()) return out;
        Set<String> known = new HashSet<>();
        for (Property p : declared) {
            known.add(p.getName());
            known.add(stripSlash(p.getJsonPath()));
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = record.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            if (known.contains(key) || config.getExcludedProperties().contains(key)) continue;
            PropertyValue v = infer(e.getValue());
            if (v == null || !config.allows(v.getType())) continue;
            out.put(key, v);
        }
        return out;
    }

    static PropertyValue infer(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        if (node.isBoolean()) return PropertyValue.of(NebulaType.BOOL, node.booleanValue());
        if (node.isIntegralNumber() && node.canConvertToLong()) return PropertyValue.of(NebulaType.INT64, node.longValue());
        if (node.isNumber()) {
            double d = node.doubleValue();
            return Double.isFinite(d) ? PropertyValue.of(NebulaType.DOUBLE, d) : null;
        }
        return PropertyValue.of(NebulaType.STRING, node.asText());
    }

    private static String stripSlash(String path) {
        return path != null && path.startsWith("/") ? path.substring(1) : path;
    }
}
