package vn.com.fecredit.graph.mapper.service;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.graph.mapper.exception.DocumentParseException;
import vn.com.fecredit.graph.mapper.exception.ErrorKind;
import vn.com.fecredit.graph.mapper.service.metadata.MappingDefinition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MappingResourceLoaderTest {

    private final MappingResourceLoader loader = new MappingResourceLoader();

    @Test
    void loads_classpath_mappings() {
        MappingDefinition def = loader.fromClasspath("mappings/places.yaml");
        assertThat(def.tags).containsKeys("Place", "User");
        assertThat(def.edges).containsKey("Comment");
        assertThat(def.settings.stringLength).isEqualTo(128);
        assertThat(def.tags.get("User").dynamicFields.asBoolean()).isTrue();
    }

    @Test
    void yaml_syntax_errors_carry_a_location() {
        assertThatThrownBy(() -> loader.fromString("tags:\n  Place:\n    from: [unclosed\n"))
                .isInstanceOf(DocumentParseException.class)
                .satisfies(e -> {
                    DocumentParseException dpe = (DocumentParseException) e;
                    assertThat(dpe.getKind()).isEqualTo(ErrorKind.YAML);
                    assertThat(dpe.getLine()).isNotNull();
                    assertThat(dpe.describe()).startsWith("YAML Error: ");
                });
    }

    @Test
    void missing_resources_and_empty_text_fail() {
        assertThatThrownBy(() -> loader.fromClasspath("mappings/nope.yaml"))
                .isInstanceOf(DocumentParseException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> loader.fromString(""))
                .isInstanceOf(DocumentParseException.class)
                .hasMessage("Empty mapping document");
    }
}
