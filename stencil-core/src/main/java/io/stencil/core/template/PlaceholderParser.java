package io.stencil.core.template;

import java.util.Objects;
import java.util.regex.Pattern;

/// Splits templates into literal text and `${key,alignment:format}` placeholders.
///
/// ### Grammar
/// `${`, then a key of one or more characters other than `,` `:` `}`, then optionally
/// `,` and an alignment field (characters other than `,` `:` `}`), then optionally `:`
/// and a format field (characters other than `}`), then `}`.
///
/// Delimiters cannot be escaped. Text that does not complete a placeholder (no closing
/// brace, empty key, a second comma) is kept as literal text.
///
/// @implNote Stateless and thread-safe.
public final class PlaceholderParser {

    static final Pattern PLACEHOLDER_PATTERN =
            Pattern.compile("\\$\\{([^,:}]+?)(?:,([^,:}]*?))?(?::([^}]*?))?\\}");

    /// Parses a template.
    ///
    /// Scanning is lazy: the template is matched as the returned sequence is iterated,
    /// and every new iteration starts again from the beginning.
    ///
    /// @param template the template, not null
    /// @return the segment sequence, never null
    /// @throws NullPointerException if template is null
    public ParsedTemplate parse(String template) {
        return new ParsedTemplate(Objects.requireNonNull(template, "template must not be null"));
    }
}
