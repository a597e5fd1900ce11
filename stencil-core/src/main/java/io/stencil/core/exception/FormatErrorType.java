package io.stencil.core.exception;

/// Categories of {@link StencilFormatException}.
public enum FormatErrorType {
    KEY_NOT_FOUND,
    INVALID_ALIGNMENT,
    INVALID_FORMAT
}
