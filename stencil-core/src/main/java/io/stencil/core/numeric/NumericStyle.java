package io.stencil.core.numeric;

import java.util.Arrays;
import java.util.Optional;

/// The standard numeric format styles, one per specifier letter.
///
/// Locale-aware styles render through a {@link NumberFormatBackend}; the others render
/// identically in every locale.
public enum NumericStyle {
    DECIMAL('d', 0, false),
    EXPONENTIAL('e', 6, false),
    FIXED_POINT('f', 2, true),
    GENERAL('g', 15, false),
    NUMBER('n', 2, true),
    PERCENT('p', 2, true),
    HEXADECIMAL('x', 0, false);

    private final char letter;
    private final int defaultPrecision;
    private final boolean localeAware;

    NumericStyle(char letter, int defaultPrecision, boolean localeAware) {
        this.letter = letter;
        this.defaultPrecision = defaultPrecision;
        this.localeAware = localeAware;
    }

    /// @return precision used when the specifier carries no digits
    public int defaultPrecision() {
        return defaultPrecision;
    }

    /// @return `true` if the style renders the locale's symbols and case rules
    public boolean isLocaleAware() {
        return localeAware;
    }

    /// Looks up the style for a specifier letter, ignoring case.
    ///
    /// @param letter the specifier letter
    /// @return the matching style, or empty if the letter is not a standard specifier
    public static Optional<NumericStyle> forLetter(char letter) {
        char lower = Character.toLowerCase(letter);
        return Arrays.stream(values()).filter(style -> style.letter == lower).findFirst();
    }
}
