package io.stencil.core.numeric;

import io.stencil.core.exception.InvalidFormatException;
import io.stencil.core.value.NumberValue;
import java.util.Locale;
import java.util.Objects;

/// Renders numbers through the standard numeric format specifiers.
///
/// ### Specifiers
/// | Letter | Style | Default precision |
/// |---|---|---|
/// | `d` `D` | decimal, zero-padded to `precision` characters | 0 |
/// | `e` `E` | exponential with `precision` fraction digits | 6 |
/// | `f` `F` | fixed-point, no grouping, locale-aware | 2 |
/// | `g` `G` | `precision` significant digits | 15 |
/// | `n` `N` | grouped, locale-aware | 2 |
/// | `p` `P` | percent, locale-aware | 2 |
/// | `x` `X` | hexadecimal of the absolute value, zero-padded | 0 |
///
/// An empty specifier renders the canonical form: shortest round-trip digits without
/// grouping or forced fraction digits.
///
/// Only `f`, `n` and `p` consult the locale. An upper-case letter upper-cases the whole
/// result: with the call's locale for those styles, with `Locale.ROOT` for the others
/// so that they render the same everywhere.
///
/// @implNote Immutable and thread-safe when the backend is.
///
/// @see NumberFormatBackend
/// @see FormatSpecifier
public final class NumericFormatter {

    private final NumberFormatBackend backend;

    /// Creates a formatter backed by the JDK locale data.
    public NumericFormatter() {
        this(new JdkNumberFormatBackend());
    }

    /// Creates a formatter with a custom locale backend.
    ///
    /// @param backend source of locale-aware rendering, not null
    /// @throws NullPointerException if backend is null
    public NumericFormatter(NumberFormatBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    /// Formats a number.
    ///
    /// @param value the number, not null
    /// @param specifier the format specifier, not null (empty for canonical form)
    /// @param locale locale for the locale-aware styles, not null
    /// @return the rendered number, never null
    /// @throws InvalidFormatException if the specifier is not a standard numeric specifier
    public String format(NumberValue value, String specifier, Locale locale) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(specifier, "specifier must not be null");
        Objects.requireNonNull(locale, "locale must not be null");

        if (specifier.isEmpty()) {
            return DecimalLayout.canonical(value);
        }

        FormatSpecifier parsed = FormatSpecifier.parse(specifier);
        NumericStyle style = parsed.style();
        int precision = parsed.effectivePrecision();

        String text =
                switch (style) {
                    case DECIMAL -> sign(value)
                            + DecimalLayout.padStart(
                                    DecimalLayout.magnitude(value), precision, '0');
                    case EXPONENTIAL -> DecimalLayout.exponential(value, precision);
                    case FIXED_POINT -> backend.formatFixed(
                            value, precision, Math.max(precision, 3), locale);
                    case GENERAL -> {
                        if (precision < 1) {
                            throw new InvalidFormatException(
                                    "Invalid precision for general format: " + specifier,
                                    specifier);
                        }
                        yield DecimalLayout.precision(value, precision);
                    }
                    case NUMBER -> backend.formatGrouped(value, precision, locale);
                    case PERCENT -> backend.formatPercent(value, precision, locale);
                    case HEXADECIMAL -> sign(value)
                            + DecimalLayout.padStart(
                                    DecimalLayout.hexadecimal(value), precision, '0');
                };

        if (!parsed.upperCase()) {
            return text;
        }
        return text.toUpperCase(style.isLocaleAware() ? locale : Locale.ROOT);
    }

    private static String sign(NumberValue value) {
        return value.isNegative() ? "-" : "";
    }
}
