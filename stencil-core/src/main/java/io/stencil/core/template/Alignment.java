package io.stencil.core.template;

import io.stencil.core.exception.InvalidAlignmentException;

/// Minimum width of a rendered placeholder.
///
/// A positive width pads on the left, a negative width pads on the right, zero leaves
/// the text alone. Padding uses U+0020 and never truncates. Widths are measured in
/// UTF-16 code units (`String.length()`), not display columns.
///
/// @param width signed width, `0` for no padding
public record Alignment(int width) {

    public static final Alignment NONE = new Alignment(0);

    /// Maximum number of digits that can still fit an `int`.
    private static final int MAX_DIGITS = 10;

    /// Parses the raw alignment field of a placeholder.
    ///
    /// Reads a leading integer: whitespace and line terminators are skipped, one `+` or
    /// `-` is accepted, then at least one ASCII digit is required. Text after the digits
    /// is ignored, so `" -8"` and `"8px"` both parse. A null or empty field means no
    /// alignment.
    ///
    /// @param raw the alignment text, may be null
    /// @return the alignment, never null
    /// @throws InvalidAlignmentException if no integer can be read or it exceeds `int`
    public static Alignment parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return NONE;
        }

        int i = 0;
        int length = raw.length();
        while (i < length && isSpace(raw.charAt(i))) {
            i++;
        }

        boolean negative = false;
        if (i < length && (raw.charAt(i) == '+' || raw.charAt(i) == '-')) {
            negative = raw.charAt(i) == '-';
            i++;
        }

        int digitsStart = i;
        while (i < length && raw.charAt(i) >= '0' && raw.charAt(i) <= '9') {
            i++;
        }
        if (i == digitsStart) {
            throw new InvalidAlignmentException(raw);
        }

        String digits = stripLeadingZeros(raw.substring(digitsStart, i));
        if (digits.length() > MAX_DIGITS) {
            throw new InvalidAlignmentException(raw);
        }
        long magnitude = Long.parseLong(digits);
        if (magnitude > Integer.MAX_VALUE) {
            throw new InvalidAlignmentException(raw);
        }
        return new Alignment(negative ? (int) -magnitude : (int) magnitude);
    }

    /// Pads text to this alignment.
    ///
    /// @param text the rendered value, not null
    /// @return the padded text, never null
    public String apply(String text) {
        int target = Math.abs(width);
        if (text.length() >= target) {
            return text;
        }
        String padding = " ".repeat(target - text.length());
        return width < 0 ? text + padding : padding + text;
    }

    /// Tab, vertical tab, form feed, line terminators, byte order mark and the `Zs`
    /// space separators. Information separators (U+001C-U+001F) are not spaces.
    private static boolean isSpace(char c) {
        switch (c) {
            case '\t', '\u000B', '\f', '\n', '\r', '\u2028', '\u2029', '\uFEFF':
                return true;
            default:
                return Character.getType(c) == Character.SPACE_SEPARATOR;
        }
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
