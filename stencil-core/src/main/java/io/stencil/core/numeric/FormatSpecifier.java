package io.stencil.core.numeric;

import io.stencil.core.exception.InvalidFormatException;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parsed standard numeric format specifier: a letter and an optional one or two
/// digit precision, e.g. `d6`, `E`, `p0`.
///
/// @param raw the specifier text as written in the template, not null
/// @param style the style selected by the letter, not null
/// @param upperCase `true` when the letter was written in upper case
/// @param precision the explicit precision, empty when the specifier has no digits
public record FormatSpecifier(
        String raw, NumericStyle style, boolean upperCase, OptionalInt precision) {

    private static final Pattern SPECIFIER_PATTERN =
            Pattern.compile("^([defgnpx])(\\d\\d?)?$", Pattern.CASE_INSENSITIVE);

    /// Parses a non-empty specifier.
    ///
    /// @param raw specifier text, not null
    /// @return the parsed specifier, never null
    /// @throws InvalidFormatException if the text does not match `letter[digits]`
    /// @throws IllegalStateException if an accepted letter has no style
    public static FormatSpecifier parse(String raw) {
        Matcher matcher = SPECIFIER_PATTERN.matcher(raw);
        if (!matcher.matches()) {
            throw new InvalidFormatException(
                    "Invalid format string for numeric type: " + raw, raw);
        }

        char letter = matcher.group(1).charAt(0);
        NumericStyle style =
                NumericStyle.forLetter(letter)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "Unknown numeric format letter: " + letter));

        String digits = matcher.group(2);
        OptionalInt precision =
                digits == null ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(digits));
        return new FormatSpecifier(raw, style, Character.isUpperCase(letter), precision);
    }

    /// Returns the explicit precision or the style's default.
    ///
    /// @return precision in the range 0-99
    public int effectivePrecision() {
        return precision.orElse(style.defaultPrecision());
    }
}
