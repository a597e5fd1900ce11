package io.stencil.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stencil.core.Stencil;
import io.stencil.core.exception.StencilFormatException;

/// Utility class for JSON format requests and error payloads.
///
/// ### Usage
/// {@snippet :
/// // Render a request
/// String out = StencilJson.render("{\"template\":\"Hi ${name}\",\"values\":{\"name\":\"Bo\"}}",
///         stencil);
///
/// // Report a failure
/// String error = StencilJson.errorToJson(exception);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see StencilJacksonModule for the registered type handlers
public final class StencilJson {

    private StencilJson() {}

    /// Reads a format request.
    ///
    /// @param json request JSON, not null
    /// @return the request, never null
    /// @throws IllegalArgumentException if the JSON is malformed or not a valid request
    public static FormatRequest readRequest(String json) {
        FormatRequest request;
        try {
            request = createMapper().readValue(json, FormatRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to read format request", e);
        }
        // A JSON null root never reaches the deserializer
        if (request == null) {
            throw new IllegalArgumentException("Format request must be a JSON object");
        }
        return request;
    }

    /// Writes a format request.
    ///
    /// @param request the request, not null
    /// @return compact JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FormatRequest request) {
        try {
            return createMapper().writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize format request", e);
        }
    }

    /// Reads a format request and renders it.
    ///
    /// @param json request JSON, not null
    /// @param stencil the engine, not null
    /// @return the rendered template, never null
    /// @throws IllegalArgumentException if the JSON is not a valid request
    /// @throws StencilFormatException if rendering fails
    public static String render(String json, Stencil stencil) {
        return readRequest(json).renderWith(stencil);
    }

    /// Writes a formatting failure as an error payload.
    ///
    /// @param exception the failure, not null
    /// @return compact JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String errorToJson(StencilFormatException exception) {
        try {
            return createMapper().writeValueAsString(exception);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize format error", e);
        }
    }

    /// Creates an `ObjectMapper` with the Stencil module registered.
    ///
    /// @return a new mapper, never null
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new StencilJacksonModule());
        return mapper;
    }
}
