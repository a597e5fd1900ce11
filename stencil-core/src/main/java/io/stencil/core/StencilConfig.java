package io.stencil.core;

import java.util.Map;

/// Configuration options for a {@link Stencil} engine.
///
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties(Map)} to read
/// the `stencil.*` keys from a property map, or construct directly with setters.
///
/// ### Default Values
/// - `defaultLocale`: `null` (the JVM default `FORMAT` locale at call time)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to
/// be configured before passing to {@link StencilFactory}. Do not modify after the
/// engine is created.
///
/// @see StencilFactory#createStencil(StencilConfig)
/// @see Builder
public class StencilConfig {

    /// Property key for {@link #getDefaultLocale()}.
    public static final String LOCALE_PROPERTY = "stencil.locale";

    private String defaultLocale;

    /// Creates a configuration with default values.
    public StencilConfig() {}

    /// Returns the BCP 47 tag used when a call supplies no locale.
    ///
    /// @return the locale tag, or null to use the JVM default `FORMAT` locale
    public String getDefaultLocale() {
        return defaultLocale;
    }

    /// Sets the BCP 47 tag used when a call supplies no locale.
    ///
    /// @param defaultLocale locale tag such as `"en-US"`, may be null
    public void setDefaultLocale(String defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    /// Reads configuration from a property map.
    ///
    /// Recognized keys:
    /// - `stencil.locale` - default locale tag; blank values are ignored
    ///
    /// @param properties source properties, not null (may be empty)
    /// @return a new configuration, never null
    public static StencilConfig fromProperties(Map<String, String> properties) {
        StencilConfig config = new StencilConfig();
        String locale = properties.get(LOCALE_PROPERTY);
        if (locale != null && !locale.isBlank()) {
            config.setDefaultLocale(locale.trim());
        }
        return config;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link StencilConfig} instances.
    public static class Builder {
        private final StencilConfig config = new StencilConfig();

        /// Sets the default locale tag.
        ///
        /// @param defaultLocale BCP 47 tag, may be null
        /// @return this builder for chaining, never null
        public Builder defaultLocale(String defaultLocale) {
            config.defaultLocale = defaultLocale;
            return this;
        }

        /// @return the configured instance, never null
        public StencilConfig build() {
            return config;
        }
    }
}
