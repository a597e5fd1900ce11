package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.stencil.core.exception.StencilFormatException;
import java.io.IOException;
import java.io.Serial;

/// Writes a formatting failure as an error payload.
///
/// ```json
/// {"error": "KEY_NOT_FOUND", "message": "Key not found: name", "input": "name"}
/// ```
/// Stack traces and causes are never written.
class FormatExceptionSerializer extends StdSerializer<StencilFormatException> {

    @Serial private static final long serialVersionUID = 6049182734520613947L;

    FormatExceptionSerializer() {
        super(StencilFormatException.class);
    }

    @Override
    public void serialize(
            StencilFormatException exception, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("error", exception.getType().name());
        gen.writeStringField("message", exception.getMessage());
        if (exception.getInput() != null) {
            gen.writeStringField("input", exception.getInput());
        }
        gen.writeEndObject();
    }
}
