package io.stencil.core.template;

/// Sealed interface for the pieces a template is split into.
///
/// ### Permitted Implementations
/// - {@link Literal} - text copied to the output verbatim
/// - {@link Placeholder} - a `${...}` span replaced by a rendered value
///
/// @see PlaceholderParser
public sealed interface TemplateSegment permits Literal, Placeholder {

    /// @return offset of the first character of this segment in the template
    int start();

    /// @return offset one past the last character of this segment in the template
    int end();
}
