package io.stencil.core.substitution;

/// Callback form of a substitution source.
///
/// The returned value is substituted as is; the engine does not apply the format field
/// to it. Callbacks that want formatted numbers call
/// {@link io.stencil.core.Stencil#formatValue(Object, String, String)} with the format
/// they receive. Returning `null` means "no value" and fails the formatting call with a
/// {@link io.stencil.core.exception.KeyNotFoundException}.
@FunctionalInterface
public interface SubstitutionFunction {

    /// Produces the value for a placeholder.
    ///
    /// @param key the placeholder key, not null
    /// @param format the placeholder's format field, null when absent
    /// @return the raw value, or null when there is none
    Object substitute(String key, String format);
}
