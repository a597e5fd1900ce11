package io.stencil.core.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.stencil.core.exception.InvalidFormatException;
import io.stencil.core.numeric.NumericFormatter;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class ValueRendererTest {

    private static final Locale EN_US = Locale.forLanguageTag("en-US");

    private final ValueRenderer renderer = new ValueRenderer(new NumericFormatter());

    @ParameterizedTest
    @NullAndEmptySource
    void shouldRenderNaturalFormWithoutSpecifier(String format) {
        assertThat(renderer.render(new TextValue("hi"), format, EN_US)).isEqualTo("hi");
        assertThat(renderer.render(new OtherValue(true), format, EN_US)).isEqualTo("true");
        assertThat(renderer.render(new OtherValue(null), format, EN_US)).isEqualTo("null");
        assertThat(renderer.render(new NumberValue(2.0), format, EN_US)).isEqualTo("2");
    }

    @Test
    void shouldDelegateNumbersToFormatter() {
        assertThat(renderer.render(new NumberValue(7), "d3", EN_US)).isEqualTo("007");
    }

    @Test
    void shouldRejectSpecifierOnText() {
        assertThatThrownBy(() -> renderer.render(new TextValue("hi"), "d", EN_US))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessage("Invalid format string for text type: d");
    }

    @Test
    void shouldRejectSpecifierOnOtherValues() {
        assertThatThrownBy(() -> renderer.render(new OtherValue(false), "x", EN_US))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessage("Invalid format string for unknown type: x");
    }

    @Test
    void shouldRejectUnknownNumericSpecifier() {
        assertThatThrownBy(() -> renderer.render(new NumberValue(1), "q", EN_US))
                .isInstanceOf(InvalidFormatException.class)
                .hasMessage("Invalid format string for numeric type: q");
    }
}
