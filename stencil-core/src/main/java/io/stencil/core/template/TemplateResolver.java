package io.stencil.core.template;

import io.stencil.core.substitution.SubstitutionSource;
import java.util.Locale;

/// Resolves the placeholders of a template against a substitution source.
public interface TemplateResolver {

    /// Renders a template.
    ///
    /// @param template the template, not null
    /// @param source the substitution source, not null
    /// @param locale locale for locale-aware numeric formats, not null
    /// @return the fully rendered string, never null
    /// @throws io.stencil.core.exception.StencilFormatException if any placeholder fails;
    ///     no partial output is produced
    String resolve(String template, SubstitutionSource source, Locale locale);
}
