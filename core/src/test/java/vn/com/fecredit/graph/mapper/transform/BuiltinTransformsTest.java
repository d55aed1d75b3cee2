package vn.com.fecredit.graph.mapper.transform;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.graph.mapper.exception.TransformException;
import vn.com.fecredit.graph.mapper.model.NebulaType;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltinTransformsTest {

    private final TransformEngine engine = new TransformEngine();

    private TransformValue apply(String name, String input, Map<String, String> params) {
        return engine.apply(name, TransformValue.of(input), params);
    }

    @Test
    void to_boolean_accepts_the_usual_spellings() {
        assertThat(apply("to_boolean", "TRUE", Map.of()).getValue()).isEqualTo(true);
        assertThat(apply("to_boolean", "No", Map.of()).getValue()).isEqualTo(false);
        assertThat(apply("to_boolean", "1", Map.of()).getTargetType()).isEqualTo(NebulaType.BOOL);
        assertThatThrownBy(() -> apply("to_boolean", "maybe", Map.of()))
                .isInstanceOf(TransformException.class)
                .hasMessage("Invalid boolean value");
    }

    @Test
    void to_boolean_does_not_trim_surrounding_whitespace() {
        assertThatThrownBy(() -> apply("to_boolean", " yes ", Map.of()))
                .isInstanceOf(TransformException.class)
                .hasMessage("Invalid boolean value");
    }

    @Test
    void price_normalize_keeps_digits_only() {
        TransformValue v = apply("price_normalize", "$1,234.56", Map.of());
        assertThat(v.getValue()).isEqualTo(123456L);
        assertThat(v.getTargetType()).isEqualTo(NebulaType.INT64);
        assertThatThrownBy(() -> apply("price_normalize", "free", Map.of()))
                .isInstanceOf(TransformException.class)
                .hasMessage("Error parsing price");
    }

    @Test
    void string_normalize_trims_and_collapses_whitespace() {
        assertThat(apply("string_normalize", "  a   b  ", Map.of()).getValue()).isEqualTo("a b");
        assertThat(apply("string_normalize", "x\t\n y", Map.of()).getValue()).isEqualTo("x y");
    }

    @Test
    void array_join_trims_parts_and_rejoins() {
        assertThat(apply("array_join", " a , b ,c", Map.of()).getValue()).isEqualTo("a,b,c");
        assertThat(apply("array_join", "a | b", Map.of("delimiter", "|")).getValue()).isEqualTo("a|b");
        assertThat(apply("array_join", "a b", Map.of()).getValue()).isEqualTo("a b");
    }

    @Test
    void time_format_emits_canonical_timestamps() {
        TransformValue v = apply("time_format", "2024-03-05", Map.of("format", "%Y-%m-%d"));
        assertThat(v.getValue()).isEqualTo("2024-03-05 00:00:00");
        assertThat(v.getTargetType()).isEqualTo(NebulaType.TIMESTAMP);

        assertThat(apply("time_format", "05/03/2024 14:30", Map.of("format", "dd/MM/yyyy HH:mm")).getValue())
                .isEqualTo("2024-03-05 14:30:00");
        assertThat(apply("time_format", "2024.03.05 01:02:03", Map.of("format", "%Y.%m.%d %H:%M:%S")).getValue())
                .isEqualTo("2024-03-05 01:02:03");
    }

    @Test
    void time_format_failures_are_reported() {
        assertThatThrownBy(() -> apply("time_format", "2024-03-05", Map.of()))
                .isInstanceOf(TransformException.class)
                .hasMessage("Missing required parameter: format");
        assertThatThrownBy(() -> apply("time_format", "yesterday", Map.of("format", "%Y-%m-%d")))
                .isInstanceOf(TransformException.class)
                .hasMessageStartingWith("Failed to parse time value");
    }

    @Test
    void strptime_patterns_translate_with_quoted_literals() {
        assertThat(BuiltinTransforms.toJavaPattern("%Y-%m-%dT%H")).isEqualTo("yyyy'-'MM'-'dd'T'HH");
        assertThat(BuiltinTransforms.toJavaPattern("yyyy-MM-dd")).isEqualTo("yyyy-MM-dd");
    }
}
