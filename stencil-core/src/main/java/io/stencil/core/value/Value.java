package io.stencil.core.value;

/// Sealed interface for values produced by a substitution source.
///
/// Substitution sources hand back arbitrary objects; they are classified exactly once,
/// at the boundary, by {@link #of(Object)}. From then on rendering dispatches on
/// {@link #kind()} with an exhaustive `switch`, so only numbers can ever accept a
/// format specifier.
///
/// ### Permitted Implementations
/// - {@link NumberValue} - any {@link Number}, format-aware
/// - {@link TextValue} - any {@link CharSequence}
/// - {@link OtherValue} - everything else, including `null`
///
/// @implNote Implementations are immutable records and safe to share across threads.
///
/// @see ValueRenderer for rendering
public sealed interface Value permits NumberValue, TextValue, OtherValue {

    /// Returns the variant of this value.
    ///
    /// @return the kind, never null
    ValueKind kind();

    /// Classifies a raw object returned by a substitution source.
    ///
    /// @param raw the raw value, may be null
    /// @return the classified value, never null. `null` becomes an {@link OtherValue}
    static Value of(Object raw) {
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof Number number) {
            return new NumberValue(number);
        }
        if (raw instanceof CharSequence text) {
            return new TextValue(text.toString());
        }
        return new OtherValue(raw);
    }
}
