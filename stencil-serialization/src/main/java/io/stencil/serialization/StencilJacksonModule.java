package io.stencil.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stencil.core.exception.StencilFormatException;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Stencil serialization configuration.
///
/// - `FormatRequest` - `FormatRequestSerializer` / `FormatRequestDeserializer`
/// - `StencilFormatException` and subclasses - `FormatExceptionSerializer` (write only)
///
/// @implNote All registrations are explicit; no classpath scanning or reflection on
/// domain types.
/// @see StencilJson for the convenience factory API
public class StencilJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3387214096540051771L;

    public StencilJacksonModule() {
        super("StencilJacksonModule");

        addSerializer(FormatRequest.class, new FormatRequestSerializer());
        addDeserializer(FormatRequest.class, new FormatRequestDeserializer());

        addSerializer(StencilFormatException.class, new FormatExceptionSerializer());
    }
}
