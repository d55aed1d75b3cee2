package vn.com.fecredit.graph.mapper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.graph.mapper.json.JsonDocumentParser;
import vn.com.fecredit.graph.mapper.json.JsonPathNavigator;
import vn.com.fecredit.graph.mapper.service.GraphMapperPipeline;
import vn.com.fecredit.graph.mapper.service.MappingFactory;
import vn.com.fecredit.graph.mapper.service.MappingResourceLoader;
import vn.com.fecredit.graph.mapper.service.SchemaManager;
import vn.com.fecredit.graph.mapper.service.StatementGenerator;
import vn.com.fecredit.graph.mapper.transform.TransformEngine;

/**
 * Wires the core services. The core library has no Spring dependency, so every service is
 * declared here instead of being component-scanned.
 */
@Configuration
public class GraphMapperConfiguration {

    @Bean
    public ObjectMapper graphMapperObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public JsonPathNavigator jsonPathNavigator(ObjectMapper graphMapperObjectMapper) {
        return new JsonPathNavigator(graphMapperObjectMapper);
    }

    @Bean
    public TransformEngine transformEngine() {
        return new TransformEngine();
    }

    @Bean
    public SchemaManager schemaManager() {
        return new SchemaManager();
    }

    @Bean
    public StatementGenerator statementGenerator(JsonPathNavigator jsonPathNavigator, TransformEngine transformEngine) {
        return new StatementGenerator(jsonPathNavigator, transformEngine);
    }

    @Bean
    public GraphMapperPipeline graphMapperPipeline(ObjectMapper graphMapperObjectMapper, SchemaManager schemaManager,
                                                   StatementGenerator statementGenerator) {
        return new GraphMapperPipeline(new MappingResourceLoader(), new MappingFactory(),
                new JsonDocumentParser(graphMapperObjectMapper), schemaManager, statementGenerator);
    }
}
