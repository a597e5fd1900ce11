package io.stencil.core.numeric;

import io.stencil.core.value.NumberValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/// Locale-independent digit layouts: canonical, exponential, significant-digit and
/// hexadecimal. Pure functions over {@link NumberValue}.
final class DecimalLayout {

    /// Plain notation is used while the decimal point position stays within this bound.
    private static final int MAX_PLAIN_EXPONENT = 21;

    private static final int MIN_PLAIN_EXPONENT = -6;

    /// Enough for the longest binary fraction of a `double` (2^-1074).
    private static final int MAX_HEX_FRACTION_DIGITS = 1100;

    private DecimalLayout() {}

    /// Canonical round-trip form: shortest digits, no trailing `.0`, exponent notation
    /// only for very large or very small magnitudes.
    static String canonical(NumberValue value) {
        if (value.isNaN()) {
            return "NaN";
        }
        if (value.isInfinite()) {
            return value.isNegative() ? "-Infinity" : "Infinity";
        }
        if (value.isIntegralType()) {
            return value.number().toString();
        }
        return canonical(value.shortestDecimal());
    }

    static String canonical(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        String sign = decimal.signum() < 0 ? "-" : "";
        BigDecimal stripped = decimal.abs().stripTrailingZeros();
        String digits = stripped.unscaledValue().toString();
        int k = digits.length();
        int n = k - stripped.scale();

        if (k <= n && n <= MAX_PLAIN_EXPONENT) {
            return sign + digits + "0".repeat(n - k);
        }
        if (0 < n && n <= MAX_PLAIN_EXPONENT) {
            return sign + digits.substring(0, n) + "." + digits.substring(n);
        }
        if (MIN_PLAIN_EXPONENT < n && n <= 0) {
            return sign + "0." + "0".repeat(-n) + digits;
        }
        return sign + scientific(digits, n - 1);
    }

    /// Canonical form of the absolute value.
    static String magnitude(NumberValue value) {
        String canonical = canonical(value);
        return canonical.startsWith("-") ? canonical.substring(1) : canonical;
    }

    /// One integer digit, `fractionDigits` fraction digits and a signed exponent,
    /// rounded half away from zero on the exact value.
    static String exponential(NumberValue value, int fractionDigits) {
        if (!value.isFinite()) {
            return canonical(value);
        }
        BigDecimal exact = value.exactDecimal();
        String sign = exact.signum() < 0 ? "-" : "";
        Digits rounded = round(exact, fractionDigits + 1);
        return sign + scientific(rounded.digits(), rounded.exponent());
    }

    /// Exactly `significantDigits` significant digits, in plain notation when the
    /// decimal exponent lies in `[-6, significantDigits)`, exponential otherwise.
    static String precision(NumberValue value, int significantDigits) {
        if (!value.isFinite()) {
            return canonical(value);
        }
        BigDecimal exact = value.exactDecimal();
        String sign = exact.signum() < 0 ? "-" : "";
        Digits rounded = round(exact, significantDigits);
        String digits = rounded.digits();
        int e = rounded.exponent();

        if (e < MIN_PLAIN_EXPONENT || e >= significantDigits) {
            return sign + scientific(digits, e);
        }
        if (e == significantDigits - 1) {
            return sign + digits;
        }
        if (e >= 0) {
            return sign + digits.substring(0, e + 1) + "." + digits.substring(e + 1);
        }
        return sign + "0." + "0".repeat(-(e + 1)) + digits;
    }

    /// Lower-case hexadecimal of the absolute value; fractions are expanded exactly.
    static String hexadecimal(NumberValue value) {
        if (!value.isFinite()) {
            return magnitude(value);
        }
        BigDecimal exact = value.exactDecimal().abs();
        BigInteger integerPart = exact.toBigInteger();
        BigDecimal fraction = exact.subtract(new BigDecimal(integerPart));

        StringBuilder hex = new StringBuilder(integerPart.toString(16));
        if (fraction.signum() == 0) {
            return hex.toString();
        }

        hex.append('.');
        BigDecimal sixteen = BigDecimal.valueOf(16);
        for (int i = 0; i < MAX_HEX_FRACTION_DIGITS && fraction.signum() != 0; i++) {
            fraction = fraction.multiply(sixteen);
            int digit = fraction.intValue();
            hex.append(Character.forDigit(digit, 16));
            fraction = fraction.subtract(BigDecimal.valueOf(digit));
        }
        return hex.toString();
    }

    static String padStart(String text, int width, char pad) {
        if (text.length() >= width) {
            return text;
        }
        return String.valueOf(pad).repeat(width - text.length()) + text;
    }

    private static String scientific(String digits, int exponent) {
        String mantissa =
                digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
        return mantissa + "e" + (exponent < 0 ? "-" : "+") + Math.abs(exponent);
    }

    private static Digits round(BigDecimal exact, int significantDigits) {
        if (exact.signum() == 0) {
            return new Digits("0".repeat(significantDigits), 0);
        }
        BigDecimal rounded =
                exact.abs().round(new MathContext(significantDigits, RoundingMode.HALF_UP));
        String digits = rounded.unscaledValue().toString();
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (digits.length() < significantDigits) {
            digits = digits + "0".repeat(significantDigits - digits.length());
        }
        return new Digits(digits, exponent);
    }

    /// Significant digits with the decimal exponent of the first one.
    private record Digits(String digits, int exponent) {}
}
