package io.stencil.core;

import io.stencil.core.numeric.JdkNumberFormatBackend;
import io.stencil.core.numeric.NumberFormatBackend;
import io.stencil.core.numeric.NumericFormatter;
import io.stencil.core.template.CompositeTemplateResolver;
import io.stencil.core.template.PlaceholderParser;
import io.stencil.core.template.TemplateResolver;
import io.stencil.core.value.ValueRenderer;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link Stencil} engines.
///
/// ### Usage Patterns
///
/// **Builder with an explicit locale backend** (deterministic tests, custom locale data):
/// {@snippet :
/// var stencil = StencilFactory.builder()
///     .config(StencilConfig.builder().defaultLocale("en-US").build())
///     .numberFormatBackend(new JdkNumberFormatBackend())
///     .build();
/// }
///
/// **Quick start with system properties** (reads `stencil.locale`):
/// {@snippet :
/// var stencil = StencilFactory.createStencil();
/// }
///
/// @implNote This is a utility class with only static methods. All dependencies are
/// wired explicitly via constructor injection in created components.
///
/// @see Stencil
/// @see StencilConfig
public final class StencilFactory {

    private static final Logger logger = Logger.getLogger(StencilFactory.class.getName());

    private StencilFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an engine configured from JVM system properties.
    ///
    /// @return a fully-wired engine, never null
    /// @see StencilConfig#fromProperties(Map)
    public static Stencil createStencil() {
        return createStencil(StencilConfig.fromProperties(systemProperties()));
    }

    /// Creates an engine with custom configuration and the JDK locale backend.
    ///
    /// @param config configuration options, not null
    /// @return a fully-wired engine, never null
    public static Stencil createStencil(StencilConfig config) {
        return builder().config(config).build();
    }

    /// Creates a new builder for engine construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, String> systemProperties() {
        Map<String, String> properties = new HashMap<>();
        System.getProperties()
                .stringPropertyNames()
                .forEach(name -> properties.put(name, System.getProperty(name)));
        return properties;
    }

    /// Fluent builder for {@link Stencil} engines.
    ///
    /// Unset components fall back to defaults: an empty {@link StencilConfig} and a
    /// {@link JdkNumberFormatBackend}.
    public static final class Builder {
        private StencilConfig config;
        private NumberFormatBackend numberFormatBackend;

        private Builder() {}

        /// @param config configuration options, not null
        /// @return this builder for chaining, never null
        public Builder config(StencilConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the locale data source for the `f`, `n` and `p` specifiers.
        ///
        /// @param numberFormatBackend locale backend, not null
        /// @return this builder for chaining, never null
        public Builder numberFormatBackend(NumberFormatBackend numberFormatBackend) {
            this.numberFormatBackend =
                    Objects.requireNonNull(
                            numberFormatBackend, "numberFormatBackend must not be null");
            return this;
        }

        /// Wires and returns the engine.
        ///
        /// @return a new engine, never null
        public Stencil build() {
            StencilConfig effectiveConfig = config != null ? config : new StencilConfig();
            NumberFormatBackend backend =
                    numberFormatBackend != null
                            ? numberFormatBackend
                            : new JdkNumberFormatBackend();

            PlaceholderParser parser = new PlaceholderParser();
            ValueRenderer valueRenderer = new ValueRenderer(new NumericFormatter(backend));
            TemplateResolver templateResolver =
                    new CompositeTemplateResolver(parser, valueRenderer);

            logger.info(
                    "Created Stencil with default locale: "
                            + (effectiveConfig.getDefaultLocale() != null
                                    ? effectiveConfig.getDefaultLocale()
                                    : "<jvm default>")
                            + ", backend: "
                            + backend.getClass().getSimpleName());
            return new Stencil(effectiveConfig, parser, templateResolver, valueRenderer);
        }
    }
}
