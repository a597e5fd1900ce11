package io.stencil.core.value;

import java.util.Objects;

/// Textual value, rendered verbatim.
public record TextValue(String text) implements Value {

    public TextValue {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public ValueKind kind() {
        return ValueKind.TEXT;
    }
}
