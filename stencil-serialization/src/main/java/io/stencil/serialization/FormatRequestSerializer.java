package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link FormatRequest}; `locale` is omitted when null.
class FormatRequestSerializer extends StdSerializer<FormatRequest> {

    @Serial private static final long serialVersionUID = -4736219585531702215L;

    FormatRequestSerializer() {
        super(FormatRequest.class);
    }

    @Override
    public void serialize(FormatRequest request, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("template", request.template());
        gen.writeFieldName("values");
        gen.writeTree(request.values());
        if (request.locale() != null) {
            gen.writeStringField("locale", request.locale());
        }
        gen.writeEndObject();
    }
}
