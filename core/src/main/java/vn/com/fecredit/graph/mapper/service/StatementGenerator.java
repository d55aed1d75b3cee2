package vn.com.fecredit.graph.mapper.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.exception.DataExtractionException;
import vn.com.fecredit.graph.mapper.json.JsonPathNavigator;
import vn.com.fecredit.graph.mapper.model.EdgeMapping;
import vn.com.fecredit.graph.mapper.model.GraphMapping;
import vn.com.fecredit.graph.mapper.model.MappingSettings;
import vn.com.fecredit.graph.mapper.model.Property;
import vn.com.fecredit.graph.mapper.model.VertexMapping;
import vn.com.fecredit.graph.mapper.statement.DynamicPropertyHelper;
import vn.com.fecredit.graph.mapper.statement.PropertyValue;
import vn.com.fecredit.graph.mapper.statement.PropertyValueExtractor;
import vn.com.fecredit.graph.mapper.statement.StatementBatch;
import vn.com.fecredit.graph.mapper.transform.TransformEngine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static vn.com.fecredit.graph.mapper.util.IdentifierHelper.quoteIdentifier;
import static vn.com.fecredit.graph.mapper.util.IdentifierHelper.quoteString;

/**
 * Produces INSERT / UPSERT statements for every vertex mapping, then every edge mapping, of
 * a {@link GraphMapping} applied to one document.
 *
 * <p>Tags without dynamic fields are batched: tuples accumulate until {@code batchSize} is
 * reached and are flushed as one {@code INSERT VERTEX}. Tags with dynamic fields get one
 * {@code UPSERT VERTEX} per distinct id; repeated ids are dropped. The first failing record
 * aborts the whole run.</p>
 */
public class StatementGenerator {

    private static final Logger log = LoggerFactory.getLogger(StatementGenerator.class);

    public static final int DEFAULT_BATCH_SIZE = 500;

    private final JsonPathNavigator navigator;
    private final PropertyValueExtractor extractor;
    private final DynamicPropertyHelper dynamicHelper = new DynamicPropertyHelper();

    public StatementGenerator(JsonPathNavigator navigator, TransformEngine transformEngine) {
        this.navigator = navigator;
        this.extractor = new PropertyValueExtractor(navigator, transformEngine);
    }

    public List<String> generateBatchStatements(GraphMapping mapping, JsonNode document) {
        return generateBatchStatements(mapping, document, DEFAULT_BATCH_SIZE);
    }

    public List<String> generateBatchStatements(GraphMapping mapping, JsonNode document, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
        }
        List<String> out = new ArrayList<>();
        Map<String, Set<String>> seenIds = new HashMap<>();
        for (VertexMapping v : mapping.getVertices()) {
            Set<String> seen = seenIds.computeIfAbsent(v.getTagName(), k -> new HashSet<>());
            generateVertexStatements(v, document, mapping.getSettings(), batchSize, seen, out);
        }
        for (EdgeMapping e : mapping.getEdges()) {
            generateEdgeStatements(e, document, mapping.getSettings(), batchSize, out);
        }
        log.debug("Generated {} data statements", out.size());
        return out;
    }

    void generateVertexStatements(VertexMapping v, JsonNode document, MappingSettings settings, int batchSize,
                                  Set<String> seen, List<String> out) {
        String tag = quoteIdentifier(v.getTagName());
        boolean dynamic = v.getDynamicFields().isEnabled();
        StatementBatch batch = new StatementBatch("INSERT VERTEX " + tag + " (" + columns(v.getProperties())
                + ") VALUES ", batchSize, out);
        int skipped = 0;
        for (JsonNode record : records(document, v.getSourcePath())) {
            String id = extractor.extractId(record, v.getKeyPath());
            if (!dynamic) {
                batch.add(quoteString(id) + ":(" + join(values(record, v.getProperties(), settings)) + ")");
                continue;
            }
            if (!seen.add(id)) {
                skipped++;
                continue;
            }
            List<PropertyValue> values = values(record, v.getProperties(), settings);
            List<String> names = new ArrayList<>();
            for (Property p : v.getProperties()) {
                names.add(quoteIdentifier(p.getName()));
            }
            List<PropertyValue> all = new ArrayList<>(values);
            for (Map.Entry<String, PropertyValue> extra
                    : dynamicHelper.extraProperties(record, v.getProperties(), v.getDynamicFields()).entrySet()) {
                names.add(quoteIdentifier(extra.getKey()));
                all.add(extra.getValue());
            }
            out.add("UPSERT VERTEX " + tag + " " + quoteString(id) + " (" + String.join(", ", names)
                    + ") VALUES (" + join(all) + ");");
        }
        batch.flush();
        if (skipped > 0) {
            log.debug("Dropped {} duplicate ids for tag {}", skipped, v.getTagName());
        }
    }

    void generateEdgeStatements(EdgeMapping e, JsonNode document, MappingSettings settings, int batchSize,
                                List<String> out) {
        StatementBatch batch = new StatementBatch("INSERT EDGE " + quoteIdentifier(e.getEdgeName()) + " ("
                + columns(e.getProperties()) + ") VALUES ", batchSize, out);
        for (JsonNode record : records(document, e.getSourcePath())) {
            String src = extractor.extractId(record, e.getFrom().getKeyPath());
            String dst = extractor.extractId(record, e.getTo().getKeyPath());
            List<PropertyValue> values = values(record, e.getProperties(), settings);
            batch.add(quoteString(src) + " -> " + quoteString(dst) + ":(" + join(values) + ")");
        }
        batch.flush();
    }

    private List<JsonNode> records(JsonNode document, String sourcePath) {
        JsonNode source;
        try {
            source = navigator.resolve(document, sourcePath);
        } catch (DataExtractionException ex) {
            throw new DataExtractionException("Failed to extract data: " + ex.getMessage(), sourcePath, ex);
        }
        List<JsonNode> records = new ArrayList<>();
        if (source.isArray()) {
            source.forEach(records::add);
        } else {
            records.add(source);
        }
        return records;
    }

    private List<PropertyValue> values(JsonNode record, List<Property> props, MappingSettings settings) {
        List<PropertyValue> values = new ArrayList<>(props.size());
        for (Property p : props) {
            values.add(extractor.extract(record, p, settings));
        }
        return values;
    }

    private static String columns(List<Property> props) {
        return props.stream().map(p -> quoteIdentifier(p.getName())).collect(Collectors.joining(", "));
    }

    private static String join(List<PropertyValue> values) {
        return values.stream().map(PropertyValue::format).collect(Collectors.joining(", "));
    }
}
