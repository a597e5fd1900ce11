package io.stencil.core.numeric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.stencil.core.exception.InvalidFormatException;
import io.stencil.core.value.NumberValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("NumericFormatter")
class NumericFormatterTest {

    private static final Locale EN_US = Locale.forLanguageTag("en-US");
    private static final Locale DE_DE = Locale.forLanguageTag("de-DE");

    private final NumericFormatter formatter = new NumericFormatter();

    private String format(double value, String specifier) {
        return formatter.format(new NumberValue(value), specifier, EN_US);
    }

    @Nested
    @DisplayName("canonical form")
    class Canonical {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "1234.0, 1234",
            "1234.5, 1234.5",
            "0.000001, 0.000001",
            "1.5e-7, 1.5e-7",
            "1e-7, 1e-7",
            "1e21, 1e+21",
            "-0.0, 0",
            "-42.25, -42.25",
            "1e23, 1e+23",
            "4.9E-324, 5e-324",
            "2.82879384806159E17, 282879384806159000",
            "5e-324, 5e-324"
        })
        void shouldRenderShortestRoundTripDigits(double value, String expected) {
            assertThat(format(value, "")).isEqualTo(expected);
        }

        @Test
        void shouldKeepFloatingPointNoise() {
            assertThat(format(0.1 + 0.2, "")).isEqualTo("0.30000000000000004");
        }

        @Test
        void shouldRenderIntegralTypesWithToString() {
            assertThat(formatter.format(new NumberValue(100), "", EN_US)).isEqualTo("100");
            assertThat(formatter.format(new NumberValue(-7L), "", EN_US)).isEqualTo("-7");
            assertThat(
                            formatter.format(
                                    new NumberValue(new BigInteger("123456789012345678901234")),
                                    "",
                                    EN_US))
                    .isEqualTo("123456789012345678901234");
        }

        @Test
        void shouldRenderNonFiniteValues() {
            assertThat(format(Double.NaN, "")).isEqualTo("NaN");
            assertThat(format(Double.POSITIVE_INFINITY, "")).isEqualTo("Infinity");
            assertThat(format(Double.NEGATIVE_INFINITY, "")).isEqualTo("-Infinity");
        }
    }

    @Nested
    @DisplayName("decimal (d)")
    class Decimal {

        @ParameterizedTest(name = "{0}:{1} -> {2}")
        @CsvSource({
            "1234, d6, 001234",
            "-1234, d6, -001234",
            "1234, d, 1234",
            "1234, D2, 1234",
            "12.5, d4, 12.5",
            "0, d3, 000"
        })
        void shouldZeroPadMagnitudeAfterSign(double value, String specifier, String expected) {
            assertThat(format(value, specifier)).isEqualTo(expected);
        }

        @Test
        void shouldRenderNaNUnpadded() {
            assertThat(format(Double.NaN, "d")).isEqualTo("NaN");
        }

        @Test
        void shouldUpperCaseWholeResult() {
            assertThat(format(Double.NaN, "D")).isEqualTo("NAN");
        }
    }

    @Nested
    @DisplayName("exponential (e)")
    class Exponential {

        @ParameterizedTest(name = "{0}:{1} -> {2}")
        @CsvSource({
            "1234, e, 1.234000e+3",
            "1234, E2, 1.23E+3",
            "-0.000123, e3, -1.230e-4",
            "0, e, 0.000000e+0",
            "0.15, e0, 1e-1",
            "9.99, e0, 1e+1"
        })
        void shouldRoundOnExactValue(double value, String specifier, String expected) {
            assertThat(format(value, specifier)).isEqualTo(expected);
        }

        @Test
        void shouldPassNonFiniteThrough() {
            assertThat(format(Double.NEGATIVE_INFINITY, "e")).isEqualTo("-Infinity");
        }
    }

    @Nested
    @DisplayName("general (g)")
    class General {

        @ParameterizedTest(name = "{0}:{1} -> {2}")
        @CsvSource({
            "1234, g, 1234.00000000000",
            "0.1, g, 0.100000000000000",
            "1234.5678, g6, 1234.57",
            "0.000001234, g3, 0.00000123",
            "1.234e-7, g3, 1.23e-7",
            "123456, g3, 1.23e+5",
            "1e21, g, 1.00000000000000e+21",
            "123, g3, 123",
            "99.99, G3, 100"
        })
        void shouldRenderSignificantDigits(double value, String specifier, String expected) {
            assertThat(format(value, specifier)).isEqualTo(expected);
        }

        @Test
        void shouldUpperCaseExponentMarker() {
            assertThat(format(123456, "G3")).isEqualTo("1.23E+5");
        }

        @Test
        void shouldRejectZeroPrecision() {
            assertThatThrownBy(() -> format(1.5, "g0"))
                    .isInstanceOf(InvalidFormatException.class)
                    .hasMessageContaining("g0");
        }

        @Test
        void shouldPassNaNThrough() {
            assertThat(format(Double.NaN, "g")).isEqualTo("NaN");
        }
    }

    @Nested
    @DisplayName("hexadecimal (x)")
    class Hexadecimal {

        @ParameterizedTest(name = "{0}:{1} -> {2}")
        @CsvSource({
            "-1234, x, -4d2",
            "-1234, x8, -000004d2",
            "255, X4, 00FF",
            "255.5, x, ff.8",
            "0.1, x, 0.1999999999999a",
            "0, x, 0"
        })
        void shouldRenderHexOfMagnitude(double value, String specifier, String expected) {
            assertThat(format(value, specifier)).isEqualTo(expected);
        }

        @Test
        void shouldRenderLongBeyondDoublePrecision() {
            NumberValue value = new NumberValue(Long.MAX_VALUE);

            assertThat(formatter.format(value, "x", EN_US)).isEqualTo("7fffffffffffffff");
        }

        @Test
        void shouldUpperCaseInfinityIndependentOfLocale() {
            NumberValue infinity = new NumberValue(Double.POSITIVE_INFINITY);

            assertThat(formatter.format(infinity, "X", Locale.forLanguageTag("tr-TR")))
                    .isEqualTo("INFINITY");
        }
    }

    @Nested
    @DisplayName("locale-aware styles")
    class LocaleAware {

        @ParameterizedTest(name = "{0}:{1} -> {2}")
        @CsvSource({
            "1234.5, f, 1234.50",
            "1.23456, f, 1.235",
            "1234567.891, f, 1234567.891",
            "2.5, f0, 2.5",
            "1234, f, 1234.00",
            "1234567.891, n, '1,234,567.89'",
            "1234.5, n, '1,234.5'",
            "1234.5, n0, '1,235'",
            "-1234.567, N1, '-1,234.6'",
            "0.5, p0, 50%",
            "0.12345, p, 12.35%",
            "0.12345, P1, 12.3%",
            "12.34, p, '1,234%'"
        })
        void shouldFollowEnglishConventions(double value, String specifier, String expected) {
            assertThat(format(value, specifier)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0}:{1} -> {2}")
        @CsvSource({
            "1234.5, f, '1234,50'",
            "1.23456, f, '1,235'",
            "1234567.891, n, '1.234.567,89'",
            "1234.5, n, '1.234,5'"
        })
        void shouldFollowGermanConventions(double value, String specifier, String expected) {
            assertThat(formatter.format(new NumberValue(value), specifier, DE_DE))
                    .isEqualTo(expected);
        }

        @Test
        void shouldUpperCaseLocaleAwareStylesWithCallLocale() {
            NumberValue nan = new NumberValue(Double.NaN);
            Locale turkish = Locale.forLanguageTag("tr-TR");

            assertThat(formatter.format(nan, "F", turkish))
                    .isEqualTo(formatter.format(nan, "f", turkish).toUpperCase(turkish));
        }

        @Test
        void shouldRenderShortestDigitsInLocaleAwareStyles() {
            assertThat(format(1e23, "n0")).isEqualTo("100,000,000,000,000,000,000,000");
        }

        @Test
        void shouldRenderGermanPercentWithCommaAndSign() {
            String result = formatter.format(new NumberValue(0.12345), "p", DE_DE);

            assertThat(result).startsWith("12,35").endsWith("%");
        }
    }

    @Nested
    @DisplayName("specifier validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"z", "d123", "dd", "5", " d", "n2 ", "c"})
        void shouldRejectNonStandardSpecifiers(String specifier) {
            assertThatThrownBy(() -> format(1, specifier))
                    .isInstanceOf(InvalidFormatException.class)
                    .hasMessage("Invalid format string for numeric type: " + specifier);
        }
    }

    @Nested
    @DisplayName("backend delegation")
    @ExtendWith(MockitoExtension.class)
    class Delegation {

        @Mock private NumberFormatBackend backend;

        @Test
        void shouldPassFixedPointFractionBoundsToBackend() {
            NumberValue value = new NumberValue(2.5);
            when(backend.formatFixed(value, 1, 3, EN_US)).thenReturn("2.5");

            String result = new NumericFormatter(backend).format(value, "f1", EN_US);

            assertThat(result).isEqualTo("2.5");
            verify(backend).formatFixed(value, 1, 3, EN_US);
        }

        @Test
        void shouldKeepLargerFixedPointPrecisionAsMaximum() {
            NumberValue value = new NumberValue(2.5);
            when(backend.formatFixed(value, 5, 5, EN_US)).thenReturn("2.50000");

            assertThat(new NumericFormatter(backend).format(value, "f5", EN_US))
                    .isEqualTo("2.50000");
        }

        @Test
        void shouldUpperCaseBackendOutputWithCallLocale() {
            NumberValue value = new NumberValue(Double.NaN);
            when(backend.formatGrouped(eq(value), eq(2), any(Locale.class))).thenReturn("nan");

            assertThat(new NumericFormatter(backend).format(value, "N", EN_US)).isEqualTo("NAN");
        }

        @Test
        void shouldNotConsultBackendForLocaleIndependentStyles() {
            NumericFormatter withBackend = new NumericFormatter(backend);
            NumberValue value = new NumberValue(1234);

            withBackend.format(value, "d", EN_US);
            withBackend.format(value, "e", EN_US);
            withBackend.format(value, "g", EN_US);
            withBackend.format(value, "x", EN_US);
            withBackend.format(value, "", EN_US);

            verifyNoInteractions(backend);
        }
    }

    @Test
    void shouldFormatBigDecimalExactly() {
        NumberValue value = new NumberValue(new BigDecimal("0.1"));

        assertThat(formatter.format(value, "g20", EN_US)).isEqualTo("0.10000000000000000000");
    }

    @Test
    void shouldRequireNonNullArguments() {
        NumberValue value = new NumberValue(1);

        assertThatThrownBy(() -> formatter.format(null, "", EN_US))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> formatter.format(value, null, EN_US))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> formatter.format(value, "", null))
                .isInstanceOf(NullPointerException.class);
    }
}
