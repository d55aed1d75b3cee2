package vn.com.fecredit.graph.mapper.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.exception.SchemaException;
import vn.com.fecredit.graph.mapper.model.EdgeMapping;
import vn.com.fecredit.graph.mapper.model.GraphMapping;
import vn.com.fecredit.graph.mapper.model.MappingSettings;
import vn.com.fecredit.graph.mapper.model.Property;
import vn.com.fecredit.graph.mapper.model.VertexMapping;
import vn.com.fecredit.graph.mapper.util.IdentifierHelper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Schema DDL for a mapping: CREATE TAG / CREATE EDGE, property indexes and the matching
 * DROP statements. Type names are converted through a fixed table; identifiers are checked
 * before anything is rendered.
 */
public class SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    public static final int MAX_STRING_LENGTH = 65535;
    public static final int MAX_IDENTIFIER_LENGTH = 128;

    private static final Map<String, Integer> DEFAULT_LENGTHS = Map.of(
            "STRING", 256,
            "VARCHAR", 256,
            "FIXED_STRING", 32);

    private static final Set<String> RESERVED = Set.of(
            "SPACE", "TAG", "EDGE", "VERTEX", "INDEX",
            "INSERT", "UPDATE", "DELETE", "WHERE", "YIELD");

    private static final String TTL = " ttl_duration = 0, ttl_col = \"\";";

    public String convertToNebulaType(String type) {
        return convertToNebulaType(type, 0);
    }

    /**
     * @param length string length; 0 or negative selects the per-type default
     * @throws SchemaException for unknown types and lengths above 65535
     */
    public String convertToNebulaType(String type, int length) {
        String up = type == null ? "" : type.trim().toUpperCase(Locale.ROOT);
        switch (up) {
            case "INT":
            case "INTEGER":
            case "INT64":
                return "INT64";
            case "INT8":
            case "INT16":
            case "INT32":
                return up;
            case "FLOAT":
            case "DOUBLE":
                return "DOUBLE";
            case "BOOL":
            case "BOOLEAN":
                return "BOOL";
            case "TIMESTAMP":
            case "DATE":
            case "TIME":
            case "DATETIME":
                return up;
            case "STRING":
            case "VARCHAR":
            case "FIXED_STRING":
                int len = length > 0 ? length : DEFAULT_LENGTHS.get(up);
                if (len > MAX_STRING_LENGTH) {
                    throw new SchemaException("String length exceeds maximum allowed: " + len, type);
                }
                return up + "(" + len + ")";
            default:
                throw new SchemaException("Unsupported type: " + type);
        }
    }

    /** Non-empty, at most 128 characters, identifier syntax, and not a reserved word. */
    public boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty() || name.length() > MAX_IDENTIFIER_LENGTH) return false;
        if (!IdentifierHelper.isSimpleIdentifier(name)) return false;
        return !RESERVED.contains(name.toUpperCase(Locale.ROOT));
    }

    public List<SchemaElement> toSchemaElements(GraphMapping mapping) {
        List<SchemaElement> out = new ArrayList<>();
        MappingSettings settings = mapping.getSettings();
        for (VertexMapping v : mapping.getVertices()) {
            out.add(new SchemaElement(v.getTagName(), false, schemaProperties(v.getProperties(), settings), null, null));
        }
        for (EdgeMapping e : mapping.getEdges()) {
            out.add(new SchemaElement(e.getEdgeName(), true, schemaProperties(e.getProperties(), settings),
                    Set.of(e.getFrom().getTag()), Set.of(e.getTo().getTag())));
        }
        return out;
    }

    /**
     * CREATE TAG statements for every vertex mapping followed by CREATE EDGE statements for
     * every edge mapping, one line each.
     */
    public List<String> generateSchemaStatements(GraphMapping mapping) {
        List<String> out = new ArrayList<>();
        for (SchemaElement el : toSchemaElements(mapping)) {
            validate(el);
            String props = el.getProperties().stream()
                    .map(this::renderColumn)
                    .collect(Collectors.joining(", "));
            out.add("CREATE " + el.keyword() + " IF NOT EXISTS " + IdentifierHelper.quoteIdentifier(el.getName())
                    + " (" + props + ")" + TTL);
        }
        log.debug("Generated {} schema statements", out.size());
        return out;
    }

    public List<String> generateIndexStatements(GraphMapping mapping) {
        List<String> out = new ArrayList<>();
        for (SchemaElement el : toSchemaElements(mapping)) {
            validate(el);
            for (SchemaProperty p : el.getProperties()) {
                if (!p.isIndexable()) continue;
                String column = IdentifierHelper.quoteIdentifier(p.getName());
                if (p.getType().startsWith("STRING(") || p.getType().startsWith("VARCHAR(")) {
                    column = column + "(" + p.getFixedLength() + ")";
                }
                out.add("CREATE " + el.keyword() + " INDEX IF NOT EXISTS " + indexName(el.getName(), p.getName())
                        + " ON " + IdentifierHelper.quoteIdentifier(el.getName()) + "(" + column + ");");
            }
        }
        return out;
    }

    /** Drops every index first, then tags, then edges. */
    public List<String> generateCleanupStatements(GraphMapping mapping) {
        List<SchemaElement> elements = toSchemaElements(mapping);
        List<String> out = new ArrayList<>();
        for (SchemaElement el : elements) {
            for (SchemaProperty p : el.getProperties()) {
                if (p.isIndexable()) {
                    out.add("DROP " + el.keyword() + " INDEX IF EXISTS " + indexName(el.getName(), p.getName()) + ";");
                }
            }
        }
        for (SchemaElement el : elements) {
            if (!el.isEdge()) out.add("DROP TAG IF EXISTS " + IdentifierHelper.quoteIdentifier(el.getName()) + ";");
        }
        for (SchemaElement el : elements) {
            if (el.isEdge()) out.add("DROP EDGE IF EXISTS " + IdentifierHelper.quoteIdentifier(el.getName()) + ";");
        }
        return out;
    }

    /**
     * Union of two definitions of the same tag or edge. Properties match by name: nullability
     * is OR-ed, the incoming default wins, the larger length wins.
     */
    public SchemaElement mergeSchemaElements(SchemaElement existing, SchemaElement incoming) {
        if (!existing.getName().equals(incoming.getName()) || existing.isEdge() != incoming.isEdge()) {
            throw new SchemaException("Schema elements do not match",
                    existing.getName() + " vs " + incoming.getName());
        }
        Map<String, SchemaProperty> merged = new LinkedHashMap<>();
        for (SchemaProperty p : existing.getProperties()) {
            merged.put(p.getName(), p);
        }
        for (SchemaProperty p : incoming.getProperties()) {
            SchemaProperty old = merged.get(p.getName());
            if (old == null) {
                merged.put(p.getName(), p);
                continue;
            }
            Integer length = old.getFixedLength();
            String type = old.getType();
            if (p.getFixedLength() != null && (length == null || p.getFixedLength() > length)) {
                length = p.getFixedLength();
                type = p.getType();
            }
            merged.put(p.getName(), new SchemaProperty(p.getName(), type,
                    old.isNullable() || p.isNullable(),
                    p.getDefaultValue() != null ? p.getDefaultValue() : old.getDefaultValue(),
                    length, old.isIndexable() || p.isIndexable()));
        }
        Set<String> from = new LinkedHashSet<>(existing.getFromTags());
        from.addAll(incoming.getFromTags());
        Set<String> to = new LinkedHashSet<>(existing.getToTags());
        to.addAll(incoming.getToTags());
        return new SchemaElement(existing.getName(), existing.isEdge(), new ArrayList<>(merged.values()), from, to);
    }

    static String indexName(String element, String property) {
        return element + "_" + property + "_idx";
    }

    private List<SchemaProperty> schemaProperties(List<Property> props, MappingSettings settings) {
        List<SchemaProperty> out = new ArrayList<>();
        for (Property p : props) {
            String declared = p.getDeclaredType().trim().toUpperCase(Locale.ROOT);
            int length = p.getMaxLength();
            if (length <= 0 && (declared.equals("STRING") || declared.equals("VARCHAR"))) {
                length = settings.getStringLength();
            }
            String type = convertToNebulaType(declared, length);
            Integer fixed = null;
            int open = type.indexOf('(');
            if (open > 0) {
                fixed = Integer.parseInt(type.substring(open + 1, type.length() - 1));
            }
            out.add(new SchemaProperty(p.getName(), type, p.isOptional(), renderDefault(p, declared), fixed,
                    p.isIndexable()));
        }
        return out;
    }

    private static String renderDefault(Property p, String declared) {
        String d = p.getDefaultValue();
        if (d == null) return null;
        boolean stringTyped = declared.equals("STRING") || declared.equals("VARCHAR") || declared.equals("FIXED_STRING");
        if (stringTyped && !(d.length() >= 2 && d.startsWith("\"") && d.endsWith("\""))) {
            return IdentifierHelper.quoteString(d);
        }
        return d;
    }

    private String renderColumn(SchemaProperty p) {
        StringBuilder sb = new StringBuilder();
        sb.append(IdentifierHelper.quoteIdentifier(p.getName())).append(' ').append(p.getType());
        if (!p.isNullable()) sb.append(" NOT NULL");
        if (p.getDefaultValue() != null) sb.append(" DEFAULT ").append(p.getDefaultValue());
        return sb.toString();
    }

    private void validate(SchemaElement el) {
        if (!isValidIdentifier(el.getName())) {
            throw new SchemaException("Invalid identifier: " + el.getName(), el.getName());
        }
        for (SchemaProperty p : el.getProperties()) {
            if (!isValidIdentifier(p.getName())) {
                throw new SchemaException("Invalid identifier: " + p.getName(), el.getName());
            }
        }
    }
}
