package io.stencil.core.exception;

import java.io.Serial;

/// Base type for every user-facing formatting failure.
///
/// A formatting call either returns a fully rendered string or throws one of the
/// subclasses; no partial output is ever produced. All failures are caused by the
/// template or the substitution data and are never retried internally.
///
/// ### Subclasses
/// - {@link KeyNotFoundException} - the substitution source has no value for a key
/// - {@link InvalidAlignmentException} - the alignment field is not an integer
/// - {@link InvalidFormatException} - the format field does not apply to the value
///
/// @see FormatErrorType
public abstract class StencilFormatException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4410975327358170563L;

    private final FormatErrorType type;
    private final String input;

    /// Creates an exception for the given failure category.
    ///
    /// @param type failure category, not null
    /// @param message human readable description, not null
    /// @param input the offending template text (key, alignment or format), may be null
    protected StencilFormatException(FormatErrorType type, String message, String input) {
        super(message);
        this.type = type;
        this.input = input;
    }

    /// Returns the failure category.
    ///
    /// @return the category, never null
    public FormatErrorType getType() {
        return type;
    }

    /// Returns the raw template text that caused the failure.
    ///
    /// @return the offending key, alignment or format text, may be null
    public String getInput() {
        return input;
    }
}
