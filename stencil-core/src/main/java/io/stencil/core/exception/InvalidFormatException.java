package io.stencil.core.exception;

import java.io.Serial;

/// Thrown when a format specifier does not apply to the resolved value.
///
/// Raised for numeric values whose specifier violates the `letter[precision]`
/// grammar, and for any non-empty specifier applied to a non-numeric value.
public class InvalidFormatException extends StencilFormatException {

    @Serial private static final long serialVersionUID = -1053367404817452968L;

    /// Creates the exception.
    ///
    /// @param message description naming the value type, not null
    /// @param format the rejected specifier text, not null
    public InvalidFormatException(String message, String format) {
        super(FormatErrorType.INVALID_FORMAT, message, format);
    }

    /// @return the rejected specifier text, never null
    public String getFormat() {
        return getInput();
    }
}
