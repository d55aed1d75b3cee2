package vn.com.fecredit.graph.mapper.service.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POJO for the mapping YAML as written by users, before validation and resolution.
 *
 * <p>Fields are public to keep Jackson binding and test fixtures short. {@code transform}
 * and {@code dynamic_fields} accept several shapes and are kept as raw nodes.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MappingDefinition {
    public SettingsDef settings;
    /** Named transforms that properties can refer to by name. */
    public Map<String, JsonNode> transforms = new LinkedHashMap<>();
    public Map<String, TagDef> tags = new LinkedHashMap<>();
    public Map<String, EdgeDef> edges = new LinkedHashMap<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SettingsDef {
        @JsonProperty("string_length")
        public Integer stringLength;
        @JsonProperty("array_delimiter")
        public String arrayDelimiter;
        @JsonProperty("dynamic_tags")
        public Boolean dynamicTags;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TagDef {
        public String from;
        public String key;
        // true/false or {enabled, allowed_types, excluded_properties}
        @JsonProperty("dynamic_fields")
        public JsonNode dynamicFields;
        public List<PropertyDef> properties;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EdgeDef {
        public String from;
        @JsonProperty("source_tag")
        public String sourceTag;
        @JsonProperty("target_tag")
        public String targetTag;
        @JsonProperty("source_key")
        public String sourceKey;
        @JsonProperty("target_key")
        public String targetKey;
        public List<PropertyDef> properties;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PropertyDef {
        public String json;
        public String name;
        public String type;
        public Boolean optional;
        public Boolean index;
        public Boolean indexable;
        @JsonProperty("max_length")
        public Integer maxLength;
        @JsonProperty("default")
        public String defaultValue;
        // name, map or list of rules
        public JsonNode transform;

        public boolean isIndexed() {
            return Boolean.TRUE.equals(index) || Boolean.TRUE.equals(indexable);
        }
    }
}
