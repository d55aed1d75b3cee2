package vn.com.fecredit.graph.mapper.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.graph.mapper.exception.DataExtractionException;
import vn.com.fecredit.graph.mapper.exception.PathResolutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonPathNavigatorTest {

    private final ObjectMapper om = new ObjectMapper();
    private JsonPathNavigator navigator;
    private JsonNode doc;

    @BeforeEach
    void setUp() throws Exception {
        navigator = new JsonPathNavigator(om);
        doc = om.readTree("{\"a\":{\"list\":[{\"name\":\"x\"},{\"name\":\"y\"}],\"n\":5,\"flag\":true},"
                + "\"[x]\":1,\"nothing\":null}");
    }

    @Test
    void resolves_keys_and_indexes_anywhere_in_the_path() {
        assertThat(navigator.resolve(doc, "/a/list[1]/name").asText()).isEqualTo("y");
        assertThat(navigator.resolve(doc, "a/list/[0]/name").asText()).isEqualTo("x");
        assertThat(navigator.resolve(doc, "//a//n").asInt()).isEqualTo(5);
    }

    @Test
    void empty_path_and_slash_return_the_root() {
        assertThat(navigator.resolve(doc, "")).isSameAs(doc);
        assertThat(navigator.resolve(doc, "/")).isSameAs(doc);
    }

    @Test
    void non_numeric_brackets_are_plain_keys() {
        assertThat(navigator.resolve(doc, "/[x]").asInt()).isEqualTo(1);
    }

    @Test
    void json_null_is_returned_not_reported() {
        assertThat(navigator.resolve(doc, "/nothing").isNull()).isTrue();
    }

    @Test
    void reports_missing_keys_and_shape_mismatches() {
        assertThatThrownBy(() -> navigator.resolve(doc, "/a/missing"))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("Property not found: missing")
                .satisfies(e -> assertThat(((PathResolutionException) e).isNotFound()).isTrue());

        assertThatThrownBy(() -> navigator.resolve(doc, "/a/list/name"))
                .hasMessage("Expected object at path segment: name")
                .satisfies(e -> assertThat(((PathResolutionException) e).getReason())
                        .isEqualTo(PathResolutionException.Reason.TYPE_MISMATCH));

        assertThatThrownBy(() -> navigator.resolve(doc, "/a[0]"))
                .hasMessage("Expected array at path segment: [0]");

        assertThatThrownBy(() -> navigator.resolve(doc, "/a/list[5]"))
                .hasMessage("Array index out of bounds: [5]");
    }

    @Test
    void parsed_paths_are_cached_once_per_path_string() {
        JsonNode first = navigator.resolve(doc, "/a/list[0]/name");
        JsonNode second = navigator.resolve(doc, "/a/list[0]/name");
        assertThat(second).isEqualTo(first);
        assertThat(navigator.cacheSize()).isEqualTo(1);

        navigator.resolve(doc, "/a/n");
        assertThat(navigator.cacheSize()).isEqualTo(2);

        navigator.clearCache();
        assertThat(navigator.cacheSize()).isZero();
        assertThat(navigator.resolve(doc, "/a/list[0]/name")).isEqualTo(first);
    }

    @Test
    void resolve_as_is_strict_about_json_kinds() {
        assertThat(navigator.resolveAs(doc, "/a/n", Long.class)).isEqualTo(5L);
        assertThat(navigator.resolveAs(doc, "/a/n", Double.class)).isEqualTo(5.0d);
        assertThat(navigator.resolveAs(doc, "/a/flag", Boolean.class)).isTrue();
        assertThat(navigator.resolveAs(doc, "/a/list[0]/name", String.class)).isEqualTo("x");

        assertThatThrownBy(() -> navigator.resolveAs(doc, "/a/n", String.class))
                .isInstanceOf(PathResolutionException.class)
                .hasMessage("Type conversion failed");
    }

    @Test
    void resolve_or_default_maps_any_failure_to_the_default() {
        assertThat(navigator.resolveOrDefault(doc, "/a/missing", String.class, "dflt")).isEqualTo("dflt");
        assertThat(navigator.resolveOrDefault(doc, "/a/n", String.class, "dflt")).isEqualTo("dflt");
        assertThat(navigator.resolveOrDefault(doc, "/a/n", Long.class, 0L)).isEqualTo(5L);
        assertThat(navigator.hasPath(doc, "/a/list[1]")).isTrue();
        assertThat(navigator.hasPath(doc, "/a/list[2]")).isFalse();
    }

    @Test
    void dollar_paths_are_evaluated_as_json_path() {
        JsonNode names = navigator.resolve(doc, "$.a.list[*].name");
        assertThat(names.isArray()).isTrue();
        assertThat(names).hasSize(2);
        assertThat(names.get(1).asText()).isEqualTo("y");

        assertThat(navigator.resolve(doc, "$.a.list[0].name").asText()).isEqualTo("x");
        assertThat(navigator.resolve(doc, "$.a.n").asLong()).isEqualTo(5L);

        assertThatThrownBy(() -> navigator.resolve(doc, "$.a.nope"))
                .isInstanceOf(PathResolutionException.class)
                .satisfies(e -> assertThat(((PathResolutionException) e).isNotFound()).isTrue());
        assertThatThrownBy(() -> navigator.resolve(doc, "$.a["))
                .isInstanceOf(DataExtractionException.class);
    }
}
