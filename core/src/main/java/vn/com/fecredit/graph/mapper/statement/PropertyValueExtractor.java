package vn.com.fecredit.graph.mapper.statement;

import com.fasterxml.jackson.databind.JsonNode;
import vn.com.fecredit.graph.mapper.exception.DataExtractionException;
import vn.com.fecredit.graph.mapper.exception.TransformException;
import vn.com.fecredit.graph.mapper.json.JsonPathNavigator;
import vn.com.fecredit.graph.mapper.model.MappingSettings;
import vn.com.fecredit.graph.mapper.model.NebulaType;
import vn.com.fecredit.graph.mapper.model.Property;
import vn.com.fecredit.graph.mapper.model.Transform;
import vn.com.fecredit.graph.mapper.model.TransformRule;
import vn.com.fecredit.graph.mapper.model.TransformType;
import vn.com.fecredit.graph.mapper.transform.ArrayRuleMatcher;
import vn.com.fecredit.graph.mapper.transform.TransformEngine;
import vn.com.fecredit.graph.mapper.transform.TransformValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls ids and property values out of a source record: path lookup, then either a transform
 * or a direct conversion to the property type.
 */
public class PropertyValueExtractor {

    private final JsonPathNavigator navigator;
    private final TransformEngine transformEngine;

    public PropertyValueExtractor(JsonPathNavigator navigator, TransformEngine transformEngine) {
        this.navigator = navigator;
        this.transformEngine = transformEngine;
    }

    /**
     * Vertex id text: strings verbatim, integral numbers as decimal digits, other numbers as
     * plain decimals.
     */
    public String extractId(JsonNode record, String keyPath) {
        JsonNode node;
        try {
            node = navigator.resolve(record, keyPath);
        } catch (DataExtractionException e) {
            throw new DataExtractionException("Failed to extract vertex ID: " + e.getMessage(), keyPath, e);
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new DataExtractionException("Vertex ID cannot be null", keyPath);
        }
        if (node.isTextual()) return node.textValue();
        if (node.isIntegralNumber()) return node.bigIntegerValue().toString();
        if (node.isNumber()) return node.decimalValue().stripTrailingZeros().toPlainString();
        throw new DataExtractionException("Invalid vertex ID type", keyPath);
    }

    public PropertyValue extract(JsonNode record, Property property, MappingSettings settings) {
        JsonNode node;
        try {
            node = navigator.resolve(record, property.getJsonPath());
        } catch (DataExtractionException e) {
            throw new DataExtractionException("Failed to extract value: " + e.getMessage(), property.getJsonPath(), e);
        }
        NebulaType type = property.getNebulaType();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return PropertyValue.nullValue(type);
        }
        Transform transform = property.getTransform();
        if (transform == null) {
            return convert(node, type, property.getJsonPath());
        }
        if (transform.getType() == TransformType.ARRAY_TO_BOOL) {
            boolean hit = false;
            for (TransformRule rule : transform.getRules()) {
                hit |= ArrayRuleMatcher.matches(node, rule);
            }
            return PropertyValue.of(NebulaType.BOOL, hit);
        }
        TransformValue input = toTransformInput(node, settings.getArrayDelimiter());
        TransformValue output = transformEngine.apply(transform.functionName(), input, transform.getParams());
        return fromTransform(output, type);
    }

    /**
     * INT64 takes any JSON number (fractions truncated), DOUBLE any number, BOOL a boolean,
     * every other type a string.
     */
    PropertyValue convert(JsonNode node, NebulaType type, String path) {
        switch (type) {
            case INT64:
                if (node.isNumber() && node.canConvertToLong()) return PropertyValue.of(type, node.longValue());
                break;
            case DOUBLE:
                if (node.isNumber()) {
                    double d = node.doubleValue();
                    if (Double.isNaN(d) || Double.isInfinite(d)) {
                        throw new DataExtractionException("Value conversion error: number out of range", path);
                    }
                    return PropertyValue.of(type, d);
                }
                break;
            case BOOL:
                if (node.isBoolean()) return PropertyValue.of(type, node.booleanValue());
                break;
            default:
                if (node.isTextual()) return PropertyValue.of(type, node.textValue());
                break;
        }
        throw new DataExtractionException("Value conversion error: expected " + type + " but found "
                + node.getNodeType(), path);
    }

    private static TransformValue toTransformInput(JsonNode node, String delimiter) {
        if (node.isTextual()) return TransformValue.of(node.textValue());
        if (node.isBoolean()) return TransformValue.of(node.booleanValue());
        if (node.isIntegralNumber() && node.canConvertToLong()) return TransformValue.of(node.longValue());
        if (node.isNumber()) return TransformValue.of(node.doubleValue());
        if (node.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode el : node) {
                if (!el.isValueNode()) {
                    throw new TransformException("Unsupported value type for transformation", node.toString());
                }
                parts.add(el.isNumber() && !el.isIntegralNumber()
                        ? TransformValue.formatDouble(el.doubleValue()) : el.asText());
            }
            return TransformValue.of(String.join(delimiter, parts));
        }
        throw new TransformException("Unsupported value type for transformation", node.toString());
    }

    private static PropertyValue fromTransform(TransformValue out, NebulaType type) {
        switch (type) {
            case INT64:
                return PropertyValue.of(type, out.as(Long.class));
            case DOUBLE:
                return PropertyValue.of(type, out.as(Double.class));
            case BOOL:
                return PropertyValue.of(type, out.as(Boolean.class));
            default:
                return PropertyValue.of(type, out.as(String.class));
        }
    }
}
