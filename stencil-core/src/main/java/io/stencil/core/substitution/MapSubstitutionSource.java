package io.stencil.core.substitution;

import io.stencil.core.value.Value;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// {@link SubstitutionSource} backed by a caller-owned map.
///
/// Presence is decided by {@link Map#containsKey}, so a key mapped to `null` resolves
/// to a value rendering `"null"` while an unmapped key is absent.
public final class MapSubstitutionSource implements SubstitutionSource {

    private final Map<String, ?> values;

    /// @param values the substitutions, not null. Not copied; never modified
    public MapSubstitutionSource(Map<String, ?> values) {
        this.values = Objects.requireNonNull(values, "values must not be null");
    }

    @Override
    public Optional<Value> resolve(String key, String format) {
        if (!values.containsKey(key)) {
            return Optional.empty();
        }
        return Optional.of(Value.of(values.get(key)));
    }
}
