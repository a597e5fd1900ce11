package io.stencil.serialization;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stencil.core.Stencil;
import java.util.Objects;

/// A template together with the values and locale to render it with.
///
/// JSON shape:
/// ```json
/// {"template": "Hello ${name}!", "values": {"name": "Alice"}, "locale": "en-US"}
/// ```
/// `values` and `locale` are optional.
///
/// @param template the template, not null
/// @param values substitution object, never null (empty when omitted)
/// @param locale BCP 47 locale tag, may be null
public record FormatRequest(String template, ObjectNode values, String locale) {

    public FormatRequest {
        Objects.requireNonNull(template, "template must not be null");
        if (values == null) {
            values = JsonNodeFactory.instance.objectNode();
        }
    }

    /// Renders this request.
    ///
    /// @param stencil the engine, not null
    /// @return the rendered template, never null
    /// @throws io.stencil.core.exception.StencilFormatException if rendering fails
    public String renderWith(Stencil stencil) {
        return stencil.resolve(template, new JsonNodeSubstitutionSource(values), locale);
    }
}
