package io.stencil.core;

import io.stencil.core.substitution.FunctionSubstitutionSource;
import io.stencil.core.substitution.MapSubstitutionSource;
import io.stencil.core.substitution.SubstitutionFunction;
import io.stencil.core.substitution.SubstitutionSource;
import io.stencil.core.template.ParsedTemplate;
import io.stencil.core.template.PlaceholderParser;
import io.stencil.core.template.TemplateResolver;
import io.stencil.core.value.Value;
import io.stencil.core.value.ValueRenderer;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Composite-string formatting engine.
///
/// Replaces `${key}`, `${key,alignment}`, `${key:format}` and
/// `${key,alignment:format}` placeholders with values from a map or a callback.
///
/// {@snippet :
/// Stencil stencil = StencilFactory.createStencil();
/// stencil.format("Total: ${amount,10:n2}", Map.of("amount", 1234.5), "en-US");
/// // "Total:    1,234.5"
/// }
///
/// Locale arguments are BCP 47 tags; `null` falls back to the configured default
/// locale, then to the JVM default `FORMAT` locale.
///
/// @implNote Immutable and thread-safe. Concurrent calls share no mutable state;
/// substitution sources must tolerate concurrent reads when shared across threads.
///
/// @see StencilFactory for construction
/// @see io.stencil.core.numeric.NumericFormatter for the numeric specifiers
public final class Stencil {

    private final StencilConfig config;
    private final PlaceholderParser parser;
    private final TemplateResolver templateResolver;
    private final ValueRenderer valueRenderer;

    Stencil(
            StencilConfig config,
            PlaceholderParser parser,
            TemplateResolver templateResolver,
            ValueRenderer valueRenderer) {
        this.config = config;
        this.parser = parser;
        this.templateResolver = templateResolver;
        this.valueRenderer = valueRenderer;
    }

    /// Formats a template against a map in the default locale.
    ///
    /// @see #format(String, Map, String)
    public String format(String template, Map<String, ?> substitutions) {
        return format(template, substitutions, null);
    }

    /// Formats a template against a map.
    ///
    /// A key mapped to `null` renders `"null"`; only keys missing from the map fail.
    ///
    /// @param template the template, not null
    /// @param substitutions placeholder values, not null
    /// @param locale BCP 47 locale tag, may be null
    /// @return the rendered string, never null
    /// @throws io.stencil.core.exception.KeyNotFoundException if a key is not in the map
    /// @throws io.stencil.core.exception.InvalidAlignmentException if an alignment is not an
    ///     integer
    /// @throws io.stencil.core.exception.InvalidFormatException if a format does not apply
    public String format(String template, Map<String, ?> substitutions, String locale) {
        return resolve(template, new MapSubstitutionSource(substitutions), locale);
    }

    /// Formats a template against a callback in the default locale.
    ///
    /// @see #format(String, SubstitutionFunction, String)
    public String format(String template, SubstitutionFunction function) {
        return format(template, function, null);
    }

    /// Formats a template against a callback.
    ///
    /// The callback is invoked once per placeholder occurrence with the key and the raw
    /// format field. Its result is substituted in plain string form, without applying the
    /// format field, then padded to the alignment. A `null` result fails with
    /// {@link io.stencil.core.exception.KeyNotFoundException}.
    ///
    /// {@snippet :
    /// stencil.format("${amount:d6}", (key, format) -> stencil.formatValue(1234, format));
    /// // "001234"
    /// }
    ///
    /// @param template the template, not null
    /// @param function value callback, not null
    /// @param locale BCP 47 locale tag, may be null
    /// @return the rendered string, never null
    public String format(String template, SubstitutionFunction function, String locale) {
        return resolve(template, new FunctionSubstitutionSource(function), locale);
    }

    /// Formats a template against any substitution source.
    ///
    /// @param template the template, not null
    /// @param source substitution source, not null
    /// @param locale BCP 47 locale tag, may be null
    /// @return the rendered string, never null
    public String resolve(String template, SubstitutionSource source, String locale) {
        Objects.requireNonNull(template, "template must not be null");
        return templateResolver.resolve(template, source, resolveLocale(locale));
    }

    /// Formats a single value in the default locale.
    ///
    /// @see #formatValue(Object, String, String)
    public String formatValue(Object value, String format) {
        return formatValue(value, format, null);
    }

    /// Formats a single value.
    ///
    /// @param value the value, may be null (renders `"null"`)
    /// @param format the specifier, may be null or empty for the natural form
    /// @param locale BCP 47 locale tag, may be null
    /// @return the rendered value, never null
    /// @throws io.stencil.core.exception.InvalidFormatException if the format does not apply
    public String formatValue(Object value, String format, String locale) {
        return valueRenderer.render(Value.of(value), format, resolveLocale(locale));
    }

    /// Parses a template without resolving it.
    ///
    /// @param template the template, not null
    /// @return the parsed segments, never null
    public ParsedTemplate parse(String template) {
        return parser.parse(template);
    }

    /// Returns the configuration this engine was built with.
    ///
    /// @return the configuration, never null
    public StencilConfig getConfig() {
        return config;
    }

    Locale resolveLocale(String tag) {
        if (tag != null) {
            return Locale.forLanguageTag(tag);
        }
        if (config.getDefaultLocale() != null) {
            return Locale.forLanguageTag(config.getDefaultLocale());
        }
        return Locale.getDefault(Locale.Category.FORMAT);
    }
}
