package vn.com.fecredit.graph.mapper.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.json.JsonDocumentParser;
import vn.com.fecredit.graph.mapper.model.GraphMapping;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapping YAML plus JSON document in, ordered statements out: CREATE TAG, CREATE EDGE,
 * optional index DDL, vertex statements, edge statements. Either every statement is
 * returned or an exception is thrown.
 */
public class GraphMapperPipeline {

    private static final Logger log = LoggerFactory.getLogger(GraphMapperPipeline.class);

    private final MappingResourceLoader loader;
    private final MappingFactory factory;
    private final JsonDocumentParser documentParser;
    private final SchemaManager schemaManager;
    private final StatementGenerator statementGenerator;

    public GraphMapperPipeline(MappingResourceLoader loader, MappingFactory factory,
                               JsonDocumentParser documentParser, SchemaManager schemaManager,
                               StatementGenerator statementGenerator) {
        this.loader = loader;
        this.factory = factory;
        this.documentParser = documentParser;
        this.schemaManager = schemaManager;
        this.statementGenerator = statementGenerator;
    }

    public GraphMapping loadMapping(String mappingYaml) {
        return factory.create(loader.fromString(mappingYaml));
    }

    /** The JSON text is not parsed in schema-only mode. */
    public List<String> generate(String mappingYaml, String jsonText, GenerationOptions options) {
        GraphMapping mapping = loadMapping(mappingYaml);
        JsonNode document = options.isSchemaOnly() ? null : documentParser.parse(jsonText);
        return generate(mapping, document, options);
    }

    public List<String> generate(GraphMapping mapping, JsonNode document, GenerationOptions options) {
        List<String> out = new ArrayList<>(schemaManager.generateSchemaStatements(mapping));
        if (options.isIncludeIndexes()) {
            out.addAll(schemaManager.generateIndexStatements(mapping));
        }
        int schemaCount = out.size();
        if (!options.isSchemaOnly()) {
            out.addAll(statementGenerator.generateBatchStatements(mapping, document, options.getBatchSize()));
        }
        log.info("Generated {} schema and {} data statements for {} tags and {} edges",
                schemaCount, out.size() - schemaCount, mapping.getVertices().size(), mapping.getEdges().size());
        return out;
    }
}
