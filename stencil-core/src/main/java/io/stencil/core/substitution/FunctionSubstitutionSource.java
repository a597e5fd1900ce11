package io.stencil.core.substitution;

import io.stencil.core.value.Value;
import java.util.Objects;
import java.util.Optional;

/// {@link SubstitutionSource} adapter for a {@link SubstitutionFunction}.
///
/// The callback receives the format field and owns its interpretation: results are
/// substituted in their plain string form, numbers in canonical form.
public final class FunctionSubstitutionSource implements SubstitutionSource {

    private final SubstitutionFunction function;

    public FunctionSubstitutionSource(SubstitutionFunction function) {
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    @Override
    public Optional<Value> resolve(String key, String format) {
        return Optional.ofNullable(function.substitute(key, format)).map(Value::of);
    }

    @Override
    public boolean isPreformatted() {
        return true;
    }
}
