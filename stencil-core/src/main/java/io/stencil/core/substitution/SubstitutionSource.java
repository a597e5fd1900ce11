package io.stencil.core.substitution;

import io.stencil.core.value.Value;
import java.util.Optional;

/// Supplies values for placeholder keys.
///
/// The single capability behind both shapes of caller input: a key/value map
/// ({@link MapSubstitutionSource}) and a callback ({@link FunctionSubstitutionSource}).
/// The engine only reads from a source and asks it once per placeholder occurrence.
///
/// @implNote Implementations used from several threads must tolerate concurrent reads.
public interface SubstitutionSource {

    /// Resolves a placeholder key.
    ///
    /// @param key the placeholder key, not null
    /// @param format the placeholder's format field, null when the placeholder has none
    /// @return the value, or empty if the source has no value for the key
    Optional<Value> resolve(String key, String format);

    /// Returns whether resolved values already carry their final form.
    ///
    /// A preformatted source receives the format field and applies it itself; the
    /// engine then renders its values in their plain form and only pads them to the
    /// placeholder's alignment.
    ///
    /// @return `true` if the engine must not apply the format field, `false` by default
    default boolean isPreformatted() {
        return false;
    }
}
