package io.stencil.core.value;

import io.stencil.core.exception.InvalidFormatException;
import io.stencil.core.numeric.NumericFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns a {@link Value} and an optional format specifier into text.
///
/// Numbers are delegated to the {@link NumericFormatter}. Text and other values render
/// through their natural string form and reject any non-empty specifier.
///
/// @implNote Stateless and thread-safe.
public final class ValueRenderer {

    private static final Logger logger = Logger.getLogger(ValueRenderer.class.getName());

    private final NumericFormatter numericFormatter;

    /// @param numericFormatter formatter for numeric values, not null
    public ValueRenderer(NumericFormatter numericFormatter) {
        this.numericFormatter =
                Objects.requireNonNull(numericFormatter, "numericFormatter must not be null");
    }

    /// Renders a value.
    ///
    /// @param value the value, not null
    /// @param format the specifier, may be null or empty for the natural form
    /// @param locale locale for locale-aware numeric styles, not null
    /// @return the rendered text, never null
    /// @throws InvalidFormatException if the specifier does not apply to the value
    public String render(Value value, String format, Locale locale) {
        String specifier = format == null ? "" : format;
        return switch (value.kind()) {
            case NUMBER -> numericFormatter.format((NumberValue) value, specifier, locale);
            case TEXT -> plain(((TextValue) value).text(), value.kind(), specifier);
            case OTHER -> plain(((OtherValue) value).text(), value.kind(), specifier);
        };
    }

    private static String plain(String text, ValueKind kind, String specifier) {
        if (!specifier.isEmpty()) {
            logger.fine("Rejected format '" + specifier + "' for " + kind.label() + " value");
            throw new InvalidFormatException(
                    "Invalid format string for " + kind.label() + " type: " + specifier,
                    specifier);
        }
        return text;
    }
}
