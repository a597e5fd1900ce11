package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.Serial;

/// Reads a {@link FormatRequest} from its JSON object form.
///
/// `template` must be a string; `values`, when present and not `null`, must be an
/// object. Values are kept as a tree so numbers keep the type Jackson parsed.
///
/// @see FormatRequestSerializer for the inverse operation
class FormatRequestDeserializer extends StdDeserializer<FormatRequest> {

    @Serial private static final long serialVersionUID = 2163489571093361208L;

    FormatRequestDeserializer() {
        super(FormatRequest.class);
    }

    @Override
    public FormatRequest deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (root == null || !root.isObject()) {
            throw JsonMappingException.from(p, "Format request must be a JSON object");
        }

        JsonNode template = root.get("template");
        if (template == null || !template.isTextual()) {
            throw JsonMappingException.from(
                    p, "Format request requires a string 'template' field");
        }

        JsonNode values = root.get("values");
        ObjectNode valueObject = null;
        if (values != null && !values.isNull()) {
            if (!values.isObject()) {
                throw JsonMappingException.from(
                        p, "Format request 'values' must be a JSON object");
            }
            valueObject = (ObjectNode) values;
        }

        JsonNode locale = root.get("locale");
        String localeTag = locale == null || locale.isNull() ? null : locale.asText();

        return new FormatRequest(template.textValue(), valueObject, localeTag);
    }
}
