package vn.com.fecredit.graph.mapper.service;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.graph.mapper.exception.MappingConfigException;
import vn.com.fecredit.graph.mapper.model.EdgeMapping;
import vn.com.fecredit.graph.mapper.model.GraphMapping;
import vn.com.fecredit.graph.mapper.model.NebulaType;
import vn.com.fecredit.graph.mapper.model.Property;
import vn.com.fecredit.graph.mapper.model.TransformType;
import vn.com.fecredit.graph.mapper.model.VertexMapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingFactoryTest {

    private final MappingResourceLoader loader = new MappingResourceLoader();
    private final MappingFactory factory = new MappingFactory();

    private GraphMapping build(String yaml) {
        return factory.create(loader.fromString(yaml));
    }

    @Test
    void resolves_tags_with_defaults_and_aliases() {
        GraphMapping m = build(String.join("\n",
                "tags:",
                "  Place:",
                "    from: /places",
                "    properties:",
                "      - json: name",
                "        type: varchar",
                "        index: true",
                "      - json: level.nowLevel",
                "        type: integer",
                "        optional: true",
                "        default: '0'"));

        VertexMapping v = m.getVertices().get(0);
        assertThat(v.getTagName()).isEqualTo("Place");
        assertThat(v.getSourcePath()).isEqualTo("/places");
        assertThat(v.getKeyPath()).isEqualTo("id");
        assertThat(v.getDynamicFields().isEnabled()).isFalse();

        Property name = v.getProperties().get(0);
        assertThat(name.getNebulaType()).isEqualTo(NebulaType.STRING);
        assertThat(name.getDeclaredType()).isEqualTo("varchar");
        assertThat(name.isIndexable()).isTrue();

        Property level = v.getProperties().get(1);
        assertThat(level.getName()).isEqualTo("level_nowLevel");
        assertThat(level.getJsonPath()).isEqualTo("$.level.nowLevel");
        assertThat(level.getNebulaType()).isEqualTo(NebulaType.INT64);
        assertThat(level.isOptional()).isTrue();
        assertThat(level.getDefaultValue()).isEqualTo("0");

        assertThat(m.getSettings().getStringLength()).isEqualTo(256);
        assertThat(m.getSettings().getArrayDelimiter()).isEqualTo(",");
    }

    @Test
    void resolves_edges_and_dotted_source_paths() {
        GraphMapping m = build(String.join("\n",
                "settings:",
                "  array_delimiter: '|'",
                "tags:",
                "  User:",
                "    from: comment.list[*]",
                "    key: userId",
                "    dynamic_fields:",
                "      enabled: true",
                "      allowed_types: [string, int]",
                "      excluded_properties: [secret]",
                "    properties:",
                "      - json: userId",
                "        type: STRING",
                "edges:",
                "  wrote:",
                "    from: comment.list[*]",
                "    source_tag: User",
                "    target_tag: User",
                "    source_key: userId",
                "    properties:",
                "      - json: photoList[*].url",
                "        name: photos",
                "        type: STRING",
                "        transform: join"));

        VertexMapping user = m.getVertices().get(0);
        assertThat(user.getSourcePath()).isEqualTo("$.comment.list[*]");
        assertThat(user.getDynamicFields().isEnabled()).isTrue();
        assertThat(user.getDynamicFields().getAllowedTypes()).containsExactlyInAnyOrder(NebulaType.STRING, NebulaType.INT64);
        assertThat(user.getDynamicFields().getExcludedProperties()).containsExactly("secret");

        EdgeMapping e = m.getEdges().get(0);
        assertThat(e.getFrom().getTag()).isEqualTo("User");
        assertThat(e.getFrom().getKeyPath()).isEqualTo("userId");
        assertThat(e.getTo().getKeyPath()).isEqualTo("id");
        Property photos = e.getProperties().get(0);
        assertThat(photos.getJsonPath()).isEqualTo("$.photoList[*].url");
        assertThat(photos.getTransform().getType()).isEqualTo(TransformType.ARRAY_JOIN);
        assertThat(photos.getTransform().functionName()).isEqualTo("array_join");
        assertThat(photos.getTransform().getParams()).containsEntry("delimiter", "|");
    }

    @Test
    void transforms_resolve_by_name_map_or_named_section() {
        GraphMapping m = build(String.join("\n",
                "transforms:",
                "  created_ts:",
                "    function: time_format",
                "    params:",
                "      format: '%Y-%m-%d'",
                "tags:",
                "  Post:",
                "    from: /posts",
                "    properties:",
                "      - json: created",
                "        type: TIMESTAMP",
                "        transform: created_ts",
                "      - json: price",
                "        type: INT",
                "        transform: price_normalize",
                "      - json: title",
                "        transform:",
                "          type: string_normalize"));

        assertThat(m.getTransforms()).containsKey("created_ts");
        Property created = m.getVertices().get(0).getProperties().get(0);
        assertThat(created.getTransform().functionName()).isEqualTo("time_format");
        assertThat(created.getTransform().getParams()).containsEntry("format", "%Y-%m-%d");

        Property price = m.getVertices().get(0).getProperties().get(1);
        assertThat(price.getTransform().functionName()).isEqualTo("price_normalize");

        Property title = m.getVertices().get(0).getProperties().get(2);
        assertThat(title.getNebulaType()).isEqualTo(NebulaType.STRING);
        assertThat(title.getTransform().functionName()).isEqualTo("string_normalize");
    }

    @Test
    void rule_lists_expand_into_one_property_per_rule() {
        GraphMapping m = build(String.join("\n",
                "tags:",
                "  Review:",
                "    from: /reviews",
                "    properties:",
                "      - json: strengths",
                "        transform:",
                "          - name: strength_taste",
                "            type: BOOL",
                "            condition: \"id=5\"",
                "          - name: strength_value",
                "            condition: \"id=1\""));

        assertThat(m.getVertices().get(0).getProperties())
                .extracting(Property::getName)
                .containsExactly("strength_taste", "strength_value");
        Property p = m.getVertices().get(0).getProperties().get(1);
        assertThat(p.getNebulaType()).isEqualTo(NebulaType.BOOL);
        assertThat(p.getJsonPath()).isEqualTo("strengths");
        assertThat(p.getTransform().getType()).isEqualTo(TransformType.ARRAY_TO_BOOL);
        assertThat(p.getTransform().getRules()).hasSize(1);
    }

    @Test
    void invalid_definitions_list_every_error() {
        assertThatThrownBy(() -> build(String.join("\n",
                "tags:",
                "  Place:",
                "    from: ''",
                "    properties:",
                "      - json: name",
                "        type: blob",
                "      - json: name",
                "        type: STRING",
                "      - json: other")))
                .isInstanceOf(MappingConfigException.class)
                .hasMessageContaining("Source path cannot be empty: Place")
                .hasMessageContaining("Invalid property type: blob")
                .hasMessageContaining("Duplicate property name: Place.name")
                .hasMessageContaining("Property type is required: Place.other");
    }

    @Test
    void duplicates_created_by_rule_expansion_are_rejected() {
        assertThatThrownBy(() -> build(String.join("\n",
                "tags:",
                "  Review:",
                "    from: /reviews",
                "    properties:",
                "      - json: flag",
                "        type: BOOL",
                "      - json: strengths",
                "        transform:",
                "          - name: flag",
                "            condition: \"id=1\"")))
                .isInstanceOf(MappingConfigException.class)
                .hasMessage("Duplicate property name: Review.flag");
    }
}
