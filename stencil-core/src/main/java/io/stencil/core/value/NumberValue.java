package io.stencil.core.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/// Numeric value, the only variant that accepts a format specifier.
///
/// Wraps any {@link Number} and exposes it in the two decimal views the numeric
/// formatter needs:
/// - {@link #exactDecimal()} - the exact value of the underlying binary number, used
///   where rounding must follow the stored value (exponential, general, hexadecimal)
/// - {@link #shortestDecimal()} - the shortest decimal that round-trips to the same
///   `double`/`float`, used for canonical and locale-aware output
///
/// Both views are only defined for finite values; check {@link #isFinite()} first.
///
/// @param number the wrapped number, not null
public record NumberValue(Number number) implements Value {

    /// Significant digits that always identify a `double`.
    private static final int MAX_DOUBLE_DIGITS = 17;

    /// Significant digits that always identify a `float`.
    private static final int MAX_FLOAT_DIGITS = 9;

    public NumberValue {
        Objects.requireNonNull(number, "number must not be null");
    }

    @Override
    public ValueKind kind() {
        return ValueKind.NUMBER;
    }

    /// Returns whether the wrapped number is of an integral type.
    ///
    /// Integral types render through their own `toString()` and never carry a
    /// fraction, NaN or infinity.
    ///
    /// @return `true` for `Integer`, `Long`, `Short`, `Byte`, `BigInteger` and the atomics
    public boolean isIntegralType() {
        return number instanceof Integer
                || number instanceof Long
                || number instanceof Short
                || number instanceof Byte
                || number instanceof BigInteger
                || number instanceof AtomicInteger
                || number instanceof AtomicLong;
    }

    public boolean isNaN() {
        return isFloatingPoint() && Double.isNaN(number.doubleValue());
    }

    public boolean isInfinite() {
        return isFloatingPoint() && Double.isInfinite(number.doubleValue());
    }

    public boolean isFinite() {
        return !isNaN() && !isInfinite();
    }

    /// Returns whether the number is strictly below zero.
    ///
    /// Negative zero and NaN are not negative.
    ///
    /// @return `true` if the value is less than zero
    public boolean isNegative() {
        if (!isFinite()) {
            return number.doubleValue() < 0;
        }
        return exactDecimal().signum() < 0;
    }

    public double doubleValue() {
        return number.doubleValue();
    }

    /// Returns the exact decimal expansion of the wrapped number.
    ///
    /// @return exact value, never null
    /// @throws IllegalStateException if the number is NaN or infinite
    public BigDecimal exactDecimal() {
        requireFinite();
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isIntegralType()) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (number instanceof Float f) {
            return new BigDecimal(f.doubleValue());
        }
        return new BigDecimal(number.doubleValue());
    }

    /// Returns the shortest decimal that identifies the wrapped binary number.
    ///
    /// For `Double` and `Float` this is the decimal with the fewest significant digits
    /// that converts back to the same binary value, the closest one when several
    /// qualify. Every other type returns its exact value.
    ///
    /// @return shortest decimal, never null
    /// @throws IllegalStateException if the number is NaN or infinite
    public BigDecimal shortestDecimal() {
        requireFinite();
        if (number instanceof Float f) {
            float value = f;
            return shortestRoundTrip(
                    exactDecimal(), MAX_FLOAT_DIGITS, c -> c.floatValue() == value);
        }
        if (isFloatingPoint()) {
            double value = number.doubleValue();
            return shortestRoundTrip(
                    exactDecimal(), MAX_DOUBLE_DIGITS, c -> c.doubleValue() == value);
        }
        return exactDecimal();
    }

    /// Rounds to increasing precision until a candidate converts back to the binary
    /// value. The nearest candidate is tried first; near a power of two the round-trip
    /// interval is lopsided, so the neighbours on both sides are tried as well.
    private static BigDecimal shortestRoundTrip(
            BigDecimal exact, int maxDigits, Predicate<BigDecimal> roundTrips) {
        for (int digits = 1; digits <= maxDigits; digits++) {
            BigDecimal nearest = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (roundTrips.test(nearest)) {
                return nearest;
            }
            BigDecimal below = exact.round(new MathContext(digits, RoundingMode.FLOOR));
            if (roundTrips.test(below)) {
                return below;
            }
            BigDecimal above = exact.round(new MathContext(digits, RoundingMode.CEILING));
            if (roundTrips.test(above)) {
                return above;
            }
        }
        return exact;
    }

    private boolean isFloatingPoint() {
        return !isIntegralType() && !(number instanceof BigDecimal);
    }

    private void requireFinite() {
        if (!isFinite()) {
            throw new IllegalStateException("No decimal expansion for " + number);
        }
    }
}
