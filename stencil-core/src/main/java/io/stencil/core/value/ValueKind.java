package io.stencil.core.value;

/// Discriminator for {@link Value} variants.
public enum ValueKind {
    NUMBER("numeric"),
    TEXT("text"),
    OTHER("unknown");

    private final String label;

    ValueKind(String label) {
        this.label = label;
    }

    /// Returns the type name used in error messages.
    ///
    /// @return the label, never null
    public String label() {
        return label;
    }
}
