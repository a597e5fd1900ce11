package io.stencil.core.numeric;

import io.stencil.core.value.NumberValue;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

/// {@link NumberFormatBackend} on top of the JDK's `java.text` locale data.
///
/// Rounds half away from zero on the shortest decimal form of the number, so `1.005`
/// with two fraction digits renders `1.01` rather than following the binary value.
///
/// @implNote Thread-safe. `NumberFormat` is not, so a fresh instance is created
/// per call.
public class JdkNumberFormatBackend implements NumberFormatBackend {

    @Override
    public String formatFixed(
            NumberValue value,
            int minimumFractionDigits,
            int maximumFractionDigits,
            Locale locale) {
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(maximumFractionDigits);
        format.setMinimumFractionDigits(minimumFractionDigits);
        return render(format, value);
    }

    @Override
    public String formatGrouped(NumberValue value, int maximumFractionDigits, Locale locale) {
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        format.setGroupingUsed(true);
        format.setMaximumFractionDigits(maximumFractionDigits);
        format.setMinimumFractionDigits(0);
        return render(format, value);
    }

    @Override
    public String formatPercent(NumberValue value, int maximumFractionDigits, Locale locale) {
        NumberFormat format = NumberFormat.getPercentInstance(locale);
        format.setMaximumFractionDigits(maximumFractionDigits);
        format.setMinimumFractionDigits(0);
        return render(format, value);
    }

    private static String render(NumberFormat format, NumberValue value) {
        format.setRoundingMode(RoundingMode.HALF_UP);
        if (!value.isFinite()) {
            return format.format(value.doubleValue());
        }
        return format.format(value.shortestDecimal());
    }
}
