package io.stencil.core.template;

import io.stencil.core.exception.KeyNotFoundException;
import io.stencil.core.substitution.SubstitutionSource;
import io.stencil.core.value.Value;
import io.stencil.core.value.ValueRenderer;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Composite-format resolver for `${key,alignment:format}` templates.
///
/// For every placeholder, in template order:
/// 1. ask the substitution source once for `(key, format)`
/// 2. render the value through the {@link ValueRenderer}, in plain form when the source
///    is preformatted
/// 3. pad to the placeholder's {@link Alignment}
///
/// Literal text is copied unchanged. The first failure aborts the whole call.
///
/// @implNote Stateless and thread-safe.
///
/// @see PlaceholderParser for the template grammar
public class CompositeTemplateResolver implements TemplateResolver {

    private static final Logger logger =
            Logger.getLogger(CompositeTemplateResolver.class.getName());

    private final PlaceholderParser parser;
    private final ValueRenderer renderer;

    /// @param parser template parser, not null
    /// @param renderer value renderer, not null
    public CompositeTemplateResolver(PlaceholderParser parser, ValueRenderer renderer) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    @Override
    public String resolve(String template, SubstitutionSource source, Locale locale) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(locale, "locale must not be null");

        StringBuilder result = new StringBuilder(template.length());
        for (TemplateSegment segment : parser.parse(template)) {
            if (segment instanceof Placeholder placeholder) {
                result.append(render(placeholder, source, locale));
            } else if (segment instanceof Literal literal) {
                result.append(literal.text());
            }
        }
        return result.toString();
    }

    private String render(Placeholder placeholder, SubstitutionSource source, Locale locale) {
        String key = placeholder.key();
        Value value =
                source.resolve(key, placeholder.format())
                        .orElseThrow(
                                () -> {
                                    logger.fine("Key not found: " + key);
                                    return new KeyNotFoundException(key);
                                });

        String format = source.isPreformatted() ? null : placeholder.format();
        String text = renderer.render(value, format, locale);
        return Alignment.parse(placeholder.alignment()).apply(text);
    }
}
