package vn.com.fecredit.graph.mapper.json;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import vn.com.fecredit.graph.mapper.exception.DocumentParseException;
import vn.com.fecredit.graph.mapper.exception.ErrorKind;

public class JsonDocumentParser {

    private final ObjectMapper objectMapper;

    public JsonDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DocumentParseException(ErrorKind.JSON, "Empty JSON document", null, null, null);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            Integer line = loc == null ? null : loc.getLineNr();
            Integer column = loc == null ? null : loc.getColumnNr();
            throw new DocumentParseException(ErrorKind.JSON, e.getOriginalMessage(), line, column, e);
        }
    }
}
