package io.stencil.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stencil.core.substitution.SubstitutionSource;
import io.stencil.core.value.NumberValue;
import io.stencil.core.value.OtherValue;
import io.stencil.core.value.TextValue;
import io.stencil.core.value.Value;
import java.util.Objects;
import java.util.Optional;

/// {@link SubstitutionSource} over the fields of a Jackson `ObjectNode`.
///
/// Field values map onto {@link Value} variants by node type:
/// - numeric nodes - {@link NumberValue} of the node's own number type
/// - textual nodes - {@link TextValue}
/// - `null` - {@link OtherValue} rendering `"null"` (the field is present)
/// - booleans - {@link OtherValue} rendering `"true"`/`"false"`
/// - objects and arrays - {@link OtherValue} rendering compact JSON
///
/// A missing field is absent and fails the formatting call.
///
/// @implNote Safe for concurrent reads as long as the node is not modified.
public final class JsonNodeSubstitutionSource implements SubstitutionSource {

    private final ObjectNode values;

    /// @param values the substitution object, not null
    public JsonNodeSubstitutionSource(ObjectNode values) {
        this.values = Objects.requireNonNull(values, "values must not be null");
    }

    @Override
    public Optional<Value> resolve(String key, String format) {
        JsonNode node = values.get(key);
        if (node == null) {
            return Optional.empty();
        }
        return Optional.of(toValue(node));
    }

    /// Converts a JSON node into a formatting value.
    ///
    /// @param node the node, not null
    /// @return the classified value, never null
    static Value toValue(JsonNode node) {
        if (node.isNumber()) {
            return new NumberValue(node.numberValue());
        }
        if (node.isTextual()) {
            return new TextValue(node.textValue());
        }
        if (node.isNull()) {
            return new OtherValue(null);
        }
        if (node.isBoolean()) {
            return new OtherValue(node.booleanValue());
        }
        return new OtherValue(node);
    }
}
