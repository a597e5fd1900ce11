package io.stencil.core.value;

/// Any value that is neither numeric nor textual.
///
/// Renders through {@link String#valueOf(Object)}, so a `null` payload renders as
/// `"null"` and a boolean as `"true"` or `"false"`.
///
/// @param value the wrapped object, may be null
public record OtherValue(Object value) implements Value {

    @Override
    public ValueKind kind() {
        return ValueKind.OTHER;
    }

    /// Returns the natural string form of the wrapped object.
    ///
    /// @return `String.valueOf(value)`, never null
    public String text() {
        return String.valueOf(value);
    }
}
