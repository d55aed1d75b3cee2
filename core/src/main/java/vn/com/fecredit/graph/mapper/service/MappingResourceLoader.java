package vn.com.fecredit.graph.mapper.service;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.graph.mapper.exception.DocumentParseException;
import vn.com.fecredit.graph.mapper.exception.ErrorKind;
import vn.com.fecredit.graph.mapper.service.metadata.MappingDefinition;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads mapping YAML into {@link MappingDefinition}s. Nothing is validated here; see
 * {@link MappingFactory}.
 */
public class MappingResourceLoader {

    private static final Logger log = LoggerFactory.getLogger(MappingResourceLoader.class);

    private final ObjectMapper yamlMapper;

    public MappingResourceLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MappingDefinition fromString(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            throw new DocumentParseException(ErrorKind.YAML, "Empty mapping document", null, null, null);
        }
        try {
            MappingDefinition def = yamlMapper.readValue(yaml, MappingDefinition.class);
            if (def == null) {
                throw new DocumentParseException(ErrorKind.YAML, "Empty mapping document", null, null, null);
            }
            return def;
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            throw new DocumentParseException(ErrorKind.YAML, e.getOriginalMessage(),
                    loc == null ? null : loc.getLineNr(),
                    loc == null ? null : loc.getColumnNr(), e);
        }
    }

    public MappingDefinition fromFile(Path file) {
        log.debug("Loading mapping from {}", file);
        try {
            return fromString(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DocumentParseException(ErrorKind.YAML, "Cannot read mapping file: " + file, null, null, e);
        }
    }

    public MappingDefinition fromClasspath(String resource) {
        try (InputStream is = MappingResourceLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new DocumentParseException(ErrorKind.YAML,
                        "Mapping resource not found on classpath: " + resource, null, null, null);
            }
            return fromString(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DocumentParseException(ErrorKind.YAML, "Cannot read mapping resource: " + resource, null, null, e);
        }
    }
}
