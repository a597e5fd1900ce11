package io.stencil.core.numeric;

import io.stencil.core.value.NumberValue;
import java.util.Locale;

/// Locale data capability behind the locale-aware specifiers (`f`, `n`, `p`).
///
/// Injected into {@link NumericFormatter} so that decimal separators, grouping and
/// percent patterns come from a replaceable source instead of a global default.
/// Implementations receive non-finite values too and must render them with the
/// locale's symbols.
///
/// @implNote Implementations must be thread-safe; a single backend serves every
/// formatting call of an engine.
///
/// @see JdkNumberFormatBackend for the default implementation
public interface NumberFormatBackend {

    /// Formats without digit grouping.
    ///
    /// @param value the number, not null
    /// @param minimumFractionDigits fraction digits always shown
    /// @param maximumFractionDigits fraction digits shown at most, not less than the minimum
    /// @param locale locale supplying the decimal separator, not null
    /// @return the formatted number, never null
    String formatFixed(
            NumberValue value, int minimumFractionDigits, int maximumFractionDigits, Locale locale);

    /// Formats with the locale's digit grouping.
    ///
    /// @param value the number, not null
    /// @param maximumFractionDigits fraction digits shown at most
    /// @param locale locale supplying separators, not null
    /// @return the formatted number, never null
    String formatGrouped(NumberValue value, int maximumFractionDigits, Locale locale);

    /// Formats `value * 100` with the locale's percent pattern.
    ///
    /// @param value the number, not null
    /// @param maximumFractionDigits fraction digits shown at most
    /// @param locale locale supplying the percent pattern, not null
    /// @return the formatted percentage, never null
    String formatPercent(NumberValue value, int maximumFractionDigits, Locale locale);
}
