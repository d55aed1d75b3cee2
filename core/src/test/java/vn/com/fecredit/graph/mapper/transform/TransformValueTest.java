package vn.com.fecredit.graph.mapper.transform;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.graph.mapper.exception.TransformException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformValueTest {

    @Test
    void coerces_between_scalars_where_possible() {
        assertThat(TransformValue.of("42").as(Long.class)).isEqualTo(42L);
        assertThat(TransformValue.of(" 2.5 ").as(Double.class)).isEqualTo(2.5d);
        assertThat(TransformValue.of(7L).as(Double.class)).isEqualTo(7.0d);
        assertThat(TransformValue.of(3.5d).as(String.class)).isEqualTo("3.5");
        assertThat(TransformValue.of(true).as(String.class)).isEqualTo("true");
        assertThat(TransformValue.of(12L).as(Long.class)).isEqualTo(12L);
    }

    @Test
    void refuses_conversions_that_do_not_apply() {
        assertThatThrownBy(() -> TransformValue.of("abc").as(Long.class))
                .isInstanceOf(TransformException.class)
                .hasMessage("Cannot convert value to requested type");
        assertThatThrownBy(() -> TransformValue.of("true").as(Boolean.class))
                .isInstanceOf(TransformException.class);
        assertThatThrownBy(() -> TransformValue.of(1.5d).as(Long.class))
                .isInstanceOf(TransformException.class);
    }

    @Test
    void doubles_format_without_exponent_or_trailing_zeros() {
        assertThat(TransformValue.formatDouble(3.5d)).isEqualTo("3.5");
        assertThat(TransformValue.formatDouble(2.0d)).isEqualTo("2");
        assertThat(TransformValue.formatDouble(1.0e10d)).isEqualTo("10000000000");
        assertThat(TransformValue.formatDouble(0.0001d)).isEqualTo("0.0001");
    }
}
