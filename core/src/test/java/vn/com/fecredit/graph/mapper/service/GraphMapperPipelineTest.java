package vn.com.fecredit.graph.mapper.service;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.graph.mapper.TestHelper;
import vn.com.fecredit.graph.mapper.exception.DocumentParseException;
import vn.com.fecredit.graph.mapper.exception.ErrorKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphMapperPipelineTest {

    private static final String TTL = " ttl_duration = 0, ttl_col = \"\";";

    private final GraphMapperPipeline pipeline = TestHelper.pipeline();
    private final String mapping = TestHelper.resource("mappings/places.yaml");
    private final String data = TestHelper.resource("data/places.json");

    @Test
    void generates_schema_then_vertices_then_edges() {
        List<String> out = pipeline.generate(mapping, data, GenerationOptions.defaults());

        assertThat(out).containsExactly(
                "CREATE TAG IF NOT EXISTS Place (cid INT64 NOT NULL, placenamefull STRING(128) NOT NULL, "
                        + "phonenum STRING(128))" + TTL,
                "CREATE TAG IF NOT EXISTS User (kakaoMapUserId STRING(128) NOT NULL, username STRING(128) NOT NULL, "
                        + "level_now INT64 NOT NULL)" + TTL,
                "CREATE EDGE IF NOT EXISTS Comment (commentid STRING(128) NOT NULL, point INT64 NOT NULL, "
                        + "strength_taste BOOL NOT NULL, strength_value BOOL NOT NULL, photoUrls STRING(128) NOT NULL)" + TTL,
                "INSERT VERTEX Place (cid, placenamefull, phonenum) VALUES \"100\":(100, \"Cafe \\\"Blue\\\"\", NULL);",
                "UPSERT VERTEX User \"u1\" (kakaoMapUserId, username, level_now, badge, placeId, commentid, point) "
                        + "VALUES (\"u1\", \"Kim Lee\", 3, \"gold\", 100, \"c1\", 5);",
                "INSERT EDGE Comment (commentid, point, strength_taste, strength_value, photoUrls) VALUES "
                        + "\"u1\" -> \"100\":(\"c1\", 5, true, false, \"a.jpg,b.jpg\"), "
                        + "\"u1\" -> \"100\":(\"c2\", 4, false, false, \"\");");
    }

    @Test
    void schema_only_skips_data_and_the_input_document() {
        List<String> out = pipeline.generate(mapping, null, new GenerationOptions(true, 500, true));

        assertThat(out).hasSize(5);
        assertThat(out.get(3)).isEqualTo("CREATE TAG INDEX IF NOT EXISTS Place_cid_idx ON Place(cid);");
        assertThat(out.get(4)).isEqualTo(
                "CREATE TAG INDEX IF NOT EXISTS Place_placenamefull_idx ON Place(placenamefull(128));");
    }

    @Test
    void malformed_input_fails_before_any_statement_is_returned() {
        assertThatThrownBy(() -> pipeline.generate(mapping, "{\"basicInfo\": ", GenerationOptions.defaults()))
                .isInstanceOf(DocumentParseException.class)
                .satisfies(e -> assertThat(((DocumentParseException) e).getKind()).isEqualTo(ErrorKind.JSON));
    }

    @Test
    void batch_size_must_be_positive() {
        assertThatThrownBy(() -> new GenerationOptions(false, 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
