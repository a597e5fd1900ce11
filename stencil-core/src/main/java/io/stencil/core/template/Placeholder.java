package io.stencil.core.template;

import java.util.Objects;

/// A parsed `${key,alignment:format}` span.
///
/// Fields hold the raw template text; nothing is trimmed or converted here. The
/// optional fields distinguish an absent separator (`null`) from an empty field (`""`).
///
/// @param key the key, never empty, never containing `,` `:` or `}`
/// @param alignment raw alignment text, null when the placeholder has no `,`
/// @param format raw format text, null when the placeholder has no `:`
/// @param start offset of the `$` in the template
/// @param end offset one past the closing `}`
public record Placeholder(String key, String alignment, String format, int start, int end)
        implements TemplateSegment {

    public Placeholder {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Placeholder key must not be empty");
        }
    }
}
