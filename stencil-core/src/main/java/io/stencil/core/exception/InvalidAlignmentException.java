package io.stencil.core.exception;

import java.io.Serial;

/// Thrown when the alignment field of a placeholder cannot be read as an integer.
public class InvalidAlignmentException extends StencilFormatException {

    @Serial private static final long serialVersionUID = 7390154638841215702L;

    public InvalidAlignmentException(String alignment) {
        super(FormatErrorType.INVALID_ALIGNMENT, "Invalid alignment: " + alignment, alignment);
    }

    /// @return the raw alignment text, never null
    public String getAlignment() {
        return getInput();
    }
}
