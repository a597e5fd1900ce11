package io.stencil.core.exception;

import java.io.Serial;

/// Thrown when a placeholder references a key the substitution source cannot resolve.
///
/// For map-backed sources only true absence triggers this; a key mapped to `null`
/// is present and renders as `"null"`. For function-backed sources a `null` return
/// means "no value".
public class KeyNotFoundException extends StencilFormatException {

    @Serial private static final long serialVersionUID = -2874061175212946420L;

    /// Creates the exception for the missing key.
    ///
    /// @param key the key that could not be resolved, not null
    public KeyNotFoundException(String key) {
        super(FormatErrorType.KEY_NOT_FOUND, "Key not found: " + key, key);
    }

    /// Returns the key that could not be resolved.
    ///
    /// @return the missing key, never null
    public String getKey() {
        return getInput();
    }
}
